package com.postal.directory.parser;

import com.postal.directory.core.model.AddressId;
import com.postal.directory.core.model.BigUser;
import com.postal.directory.core.model.BigUserId;
import com.postal.directory.core.model.LocalityId;
import com.postal.directory.core.model.NeighborhoodId;
import com.postal.directory.core.model.StateCode;

/**
 * Layout of LOG_GRANDE_USUARIO lines (9 fields): GRU_NU, UFE_SG, LOC_NU,
 * BAI_NU, LOG_NU (optional), GRU_NO, GRU_ENDERECO, CEP, GRU_NO_ABREV
 * (optional).
 */
public final class BigUserRecordKind implements RecordKind<BigUserId, BigUser> {

    public static final int FIELD_COUNT = 9;

    @Override
    public String name() {
        return "big_user";
    }

    @Override
    public int fieldCount() {
        return FIELD_COUNT;
    }

    @Override
    public BigUserId idOf(BigUser record) {
        return record.id();
    }

    @Override
    public BigUser map(RecordFields fields) {
        return new BigUser(
                fields.required(0, "GRU_NU", BigUserId::parse),
                fields.required(1, "UFE_SG", StateCode::parse),
                fields.required(2, "LOC_NU", LocalityId::parse),
                fields.required(3, "BAI_NU", NeighborhoodId::parse),
                fields.optional(4, "LOG_NU", AddressId::parse),
                fields.required(5, "GRU_NO"),
                fields.required(6, "GRU_ENDERECO"),
                fields.required(7, "CEP"),
                fields.optional(8));
    }
}
