package com.al.shopsync.exception;

import com.al.shopsync.model.enums.TransformationType;
import lombok.Getter;

@Getter
public class TransformationException extends SyncItemException {

    private final TransformationType ruleType;
    private final String field;

    public TransformationException(TransformationType ruleType, String field, String reason) {
        super("Transformation '" + ruleType.getValue() + "' failed for field '" + field + "': " + reason);
        this.ruleType = ruleType;
        this.field = field;
    }

    public TransformationException(TransformationType ruleType, String field, String reason, Throwable cause) {
        super("Transformation '" + ruleType.getValue() + "' failed for field '" + field + "': " + reason, cause);
        this.ruleType = ruleType;
        this.field = field;
    }
}
