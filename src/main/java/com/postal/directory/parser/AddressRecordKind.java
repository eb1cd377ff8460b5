package com.postal.directory.parser;

import com.postal.directory.core.model.Address;
import com.postal.directory.core.model.AddressId;
import com.postal.directory.core.model.LocalityId;
import com.postal.directory.core.model.NeighborhoodId;
import com.postal.directory.core.model.StateCode;
import com.postal.directory.core.model.StreetTypeIndicator;

/**
 * Layout of LOG_LOGRADOURO lines (11 fields):
 * <ol>
 *   <li>LOG_NU - street id</li>
 *   <li>UFE_SG - state</li>
 *   <li>LOC_NU - locality id</li>
 *   <li>BAI_NU_INI - first neighborhood id</li>
 *   <li>BAI_NU_FIM - last neighborhood id (optional)</li>
 *   <li>LOG_NO - name</li>
 *   <li>LOG_COMPLEMENTO - complement (optional)</li>
 *   <li>CEP - postal code</li>
 *   <li>TLO_TX - street type label</li>
 *   <li>LOG_STA_TLO - type usage flag (optional)</li>
 *   <li>LOG_NO_ABREV - abbreviated name (optional)</li>
 * </ol>
 */
public final class AddressRecordKind implements RecordKind<AddressId, Address> {

    public static final int FIELD_COUNT = 11;

    @Override
    public String name() {
        return "address";
    }

    @Override
    public int fieldCount() {
        return FIELD_COUNT;
    }

    @Override
    public AddressId idOf(Address record) {
        return record.id();
    }

    @Override
    public Address map(RecordFields fields) {
        return new Address(
                fields.required(0, "LOG_NU", AddressId::parse),
                fields.required(1, "UFE_SG", StateCode::parse),
                fields.required(2, "LOC_NU", LocalityId::parse),
                fields.required(3, "BAI_NU_INI", NeighborhoodId::parse),
                fields.optional(4, "BAI_NU_FIM", NeighborhoodId::parse),
                fields.required(5, "LOG_NO"),
                fields.optional(6),
                fields.required(7, "CEP"),
                fields.required(8, "TLO_TX"),
                fields.optional(9, "LOG_STA_TLO", StreetTypeIndicator::fromCode),
                fields.optional(10));
    }
}
