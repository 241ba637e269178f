package com.calexport.indexer.index;

import java.util.List;

import com.calexport.indexer.model.Field;
import com.calexport.indexer.model.ObjectHeader;
import com.calexport.indexer.model.Procedure;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Header of an object plus the first few fields and procedures; the counts are the real sizes.
 */
@Value
@Builder
public class ObjectSummary {
    ObjectHeader header;
    int propertyCount;
    @Singular
    List<Field> fields;
    int fieldCount;
    @Singular
    List<Procedure> procedures;
    int procedureCount;

    public boolean isFieldListTruncated() {
        return fields.size() < fieldCount;
    }

    public boolean isProcedureListTruncated() {
        return procedures.size() < procedureCount;
    }
}
