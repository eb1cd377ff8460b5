package com.postal.directory.parser;

import com.postal.directory.core.model.Locality;
import com.postal.directory.core.model.LocalityId;
import com.postal.directory.core.model.LocalitySituation;
import com.postal.directory.core.model.LocalityType;
import com.postal.directory.core.model.StateCode;

/**
 * Layout of LOG_LOCALIDADE lines (9 fields):
 * <ol>
 *   <li>LOC_NU - locality id</li>
 *   <li>UFE_SG - state</li>
 *   <li>LOC_NO - name</li>
 *   <li>CEP - postal code (optional)</li>
 *   <li>LOC_IN_SIT - situation</li>
 *   <li>LOC_IN_TIPO_LOC - type</li>
 *   <li>LOC_NU_SUB - parent locality id (optional)</li>
 *   <li>LOC_NO_ABREV - abbreviated name (optional)</li>
 *   <li>MUN_NU - IBGE municipality code (optional)</li>
 * </ol>
 */
public final class LocalityRecordKind implements RecordKind<LocalityId, Locality> {

    public static final int FIELD_COUNT = 9;

    @Override
    public String name() {
        return "locality";
    }

    @Override
    public int fieldCount() {
        return FIELD_COUNT;
    }

    @Override
    public LocalityId idOf(Locality record) {
        return record.id();
    }

    @Override
    public Locality map(RecordFields fields) {
        LocalityId id = fields.required(0, "LOC_NU", LocalityId::parse);
        StateCode state = fields.required(1, "UFE_SG", StateCode::parse);
        String name = fields.required(2, "LOC_NO");
        LocalitySituation situation = fields.required(4, "LOC_IN_SIT", LocalitySituation::fromCode);
        LocalityType type = fields.required(5, "LOC_IN_TIPO_LOC", LocalityType::fromCode);

        return new Locality(
                id,
                state,
                name,
                fields.optional(3),
                situation,
                type,
                fields.optional(6, "LOC_NU_SUB", LocalityId::parse),
                fields.optional(7),
                fields.optional(8));
    }
}
