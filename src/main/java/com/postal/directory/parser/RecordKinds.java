package com.postal.directory.parser;

import com.postal.directory.core.model.Address;
import com.postal.directory.core.model.AddressId;
import com.postal.directory.core.model.BigUser;
import com.postal.directory.core.model.BigUserId;
import com.postal.directory.core.model.Cpc;
import com.postal.directory.core.model.CpcId;
import com.postal.directory.core.model.Locality;
import com.postal.directory.core.model.LocalityId;
import com.postal.directory.core.model.Neighborhood;
import com.postal.directory.core.model.NeighborhoodId;
import com.postal.directory.core.model.OperationalUnit;
import com.postal.directory.core.model.OperationalUnitId;

import java.util.List;

/**
 * The six eDNE record layouts.
 */
public final class RecordKinds {

    public static final RecordKind<LocalityId, Locality> LOCALITY = new LocalityRecordKind();
    public static final RecordKind<NeighborhoodId, Neighborhood> NEIGHBORHOOD = new NeighborhoodRecordKind();
    public static final RecordKind<AddressId, Address> ADDRESS = new AddressRecordKind();
    public static final RecordKind<BigUserId, BigUser> BIG_USER = new BigUserRecordKind();
    public static final RecordKind<OperationalUnitId, OperationalUnit> OPERATIONAL_UNIT =
            new OperationalUnitRecordKind();
    public static final RecordKind<CpcId, Cpc> CPC = new CpcRecordKind();

    private RecordKinds() {
    }

    public static List<RecordKind<?, ?>> all() {
        return List.of(LOCALITY, NEIGHBORHOOD, ADDRESS, BIG_USER, OPERATIONAL_UNIT, CPC);
    }
}
