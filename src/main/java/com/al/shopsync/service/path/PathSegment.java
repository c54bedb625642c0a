package com.al.shopsync.service.path;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One step of a {@link FieldPath}: an object key, every element of an array
 * ({@code []}), or one array element ({@code [N]}).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PathSegment {

    public enum Kind {
        KEY,
        EACH,
        INDEX
    }

    Kind kind;
    String key;
    int index;

    public static PathSegment key(String key) {
        return new PathSegment(Kind.KEY, key, -1);
    }

    public static PathSegment each() {
        return new PathSegment(Kind.EACH, null, -1);
    }

    public static PathSegment index(int index) {
        return new PathSegment(Kind.INDEX, null, index);
    }

    @Override
    public String toString() {
        switch (kind) {
            case KEY:
                return key;
            case EACH:
                return "[]";
            default:
                return "[" + index + "]";
        }
    }
}
