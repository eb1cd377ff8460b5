package com.postal.directory.parser;

import com.postal.directory.core.model.Cpc;
import com.postal.directory.core.model.CpcId;
import com.postal.directory.core.model.LocalityId;
import com.postal.directory.core.model.StateCode;

/**
 * Layout of LOG_CPC lines (6 fields): CPC_NU, UFE_SG, LOC_NU, CPC_NO,
 * CPC_ENDERECO, CEP. All fields are required.
 */
public final class CpcRecordKind implements RecordKind<CpcId, Cpc> {

    public static final int FIELD_COUNT = 6;

    @Override
    public String name() {
        return "cpc";
    }

    @Override
    public int fieldCount() {
        return FIELD_COUNT;
    }

    @Override
    public CpcId idOf(Cpc record) {
        return record.id();
    }

    @Override
    public Cpc map(RecordFields fields) {
        return new Cpc(
                fields.required(0, "CPC_NU", CpcId::parse),
                fields.required(1, "UFE_SG", StateCode::parse),
                fields.required(2, "LOC_NU", LocalityId::parse),
                fields.required(3, "CPC_NO"),
                fields.required(4, "CPC_ENDERECO"),
                fields.required(5, "CEP"));
    }
}
