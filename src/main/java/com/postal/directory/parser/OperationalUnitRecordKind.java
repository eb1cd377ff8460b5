package com.postal.directory.parser;

import com.postal.directory.core.model.AddressId;
import com.postal.directory.core.model.LocalityId;
import com.postal.directory.core.model.NeighborhoodId;
import com.postal.directory.core.model.OperationalUnit;
import com.postal.directory.core.model.OperationalUnitId;
import com.postal.directory.core.model.PostBoxIndicator;
import com.postal.directory.core.model.StateCode;

/**
 * Layout of LOG_UNID_OPER lines (10 fields): UOP_NU, UFE_SG, LOC_NU, BAI_NU,
 * LOG_NU (optional), UOP_NO, UOP_ENDERECO, CEP, UOP_IN_CP, UOP_NO_ABREV
 * (optional).
 */
public final class OperationalUnitRecordKind implements RecordKind<OperationalUnitId, OperationalUnit> {

    public static final int FIELD_COUNT = 10;

    @Override
    public String name() {
        return "operational_unit";
    }

    @Override
    public int fieldCount() {
        return FIELD_COUNT;
    }

    @Override
    public OperationalUnitId idOf(OperationalUnit record) {
        return record.id();
    }

    @Override
    public OperationalUnit map(RecordFields fields) {
        return new OperationalUnit(
                fields.required(0, "UOP_NU", OperationalUnitId::parse),
                fields.required(1, "UFE_SG", StateCode::parse),
                fields.required(2, "LOC_NU", LocalityId::parse),
                fields.required(3, "BAI_NU", NeighborhoodId::parse),
                fields.optional(4, "LOG_NU", AddressId::parse),
                fields.required(5, "UOP_NO"),
                fields.required(6, "UOP_ENDERECO"),
                fields.required(7, "CEP"),
                fields.required(8, "UOP_IN_CP", PostBoxIndicator::fromCode),
                fields.optional(9));
    }
}
