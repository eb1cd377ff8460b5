package com.postal.directory.parser;

import com.postal.directory.core.model.LocalityId;
import com.postal.directory.core.model.Neighborhood;
import com.postal.directory.core.model.NeighborhoodId;
import com.postal.directory.core.model.StateCode;

/**
 * Layout of LOG_BAIRRO lines (5 fields): BAI_NU, UFE_SG, LOC_NU, BAI_NO,
 * BAI_NO_ABREV (optional).
 */
public final class NeighborhoodRecordKind implements RecordKind<NeighborhoodId, Neighborhood> {

    public static final int FIELD_COUNT = 5;

    @Override
    public String name() {
        return "neighborhood";
    }

    @Override
    public int fieldCount() {
        return FIELD_COUNT;
    }

    @Override
    public NeighborhoodId idOf(Neighborhood record) {
        return record.id();
    }

    @Override
    public Neighborhood map(RecordFields fields) {
        return new Neighborhood(
                fields.required(0, "BAI_NU", NeighborhoodId::parse),
                fields.required(1, "UFE_SG", StateCode::parse),
                fields.required(2, "LOC_NU", LocalityId::parse),
                fields.required(3, "BAI_NO"),
                fields.optional(4));
    }
}
