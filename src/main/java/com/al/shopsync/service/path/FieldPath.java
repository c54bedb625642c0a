package com.al.shopsync.service.path;

import com.al.shopsync.exception.InvalidPathException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed form of a dotted field path such as {@code mainDetail.number},
 * {@code variants[].sku} or {@code images[0].src}.
 *
 * <pre>
 * path    := segment ('.' segment)*
 * segment := key | key '[]' | key '[' digits ']'
 * </pre>
 *
 * A segment may carry several bracket suffixes ({@code matrix[][0]}).
 */
public final class FieldPath {

    private static final String METAFIELDS = "metafields";

    private final String text;
    private final List<PathSegment> segments;

    private FieldPath(String text, List<PathSegment> segments) {
        this.text = text;
        this.segments = List.copyOf(segments);
    }

    public static FieldPath parse(String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidPathException(String.valueOf(path), "path is empty");
        }
        String trimmed = path.trim();
        List<PathSegment> segments = new ArrayList<>();
        for (String token : trimmed.split("\\.", -1)) {
            parseToken(trimmed, token, segments);
        }
        return new FieldPath(trimmed, segments);
    }

    private static void parseToken(String path, String token, List<PathSegment> segments) {
        if (token.isEmpty()) {
            throw new InvalidPathException(path, "empty segment");
        }
        int bracket = token.indexOf('[');
        String key = bracket < 0 ? token : token.substring(0, bracket);
        if (key.indexOf(']') >= 0) {
            throw new InvalidPathException(path, "unbalanced ']' in '" + token + "'");
        }
        if (!key.isEmpty()) {
            segments.add(PathSegment.key(key));
        } else if (!segments.isEmpty()) {
            throw new InvalidPathException(path, "missing key before '[' in '" + token + "'");
        }
        if (bracket < 0) {
            return;
        }

        int pos = bracket;
        while (pos < token.length()) {
            if (token.charAt(pos) != '[') {
                throw new InvalidPathException(path, "unexpected text after ']' in '" + token + "'");
            }
            int close = token.indexOf(']', pos);
            if (close < 0) {
                throw new InvalidPathException(path, "missing ']' in '" + token + "'");
            }
            String inner = token.substring(pos + 1, close).trim();
            if (inner.isEmpty()) {
                segments.add(PathSegment.each());
            } else if (inner.chars().allMatch(Character::isDigit)) {
                try {
                    segments.add(PathSegment.index(Integer.parseInt(inner)));
                } catch (NumberFormatException e) {
                    throw new InvalidPathException(path, "index out of range: " + inner);
                }
            } else {
                throw new InvalidPathException(path, "non-numeric index '" + inner + "'");
            }
            pos = close + 1;
        }
    }

    public List<PathSegment> segments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    public PathSegment segment(int i) {
        return segments.get(i);
    }

    /** Whether the path fans out over an array anywhere. */
    public boolean hasEach() {
        return hasEachFrom(0);
    }

    boolean hasEachFrom(int start) {
        for (int i = start; i < segments.size(); i++) {
            if (segments.get(i).getKind() == PathSegment.Kind.EACH) {
                return true;
            }
        }
        return false;
    }

    /** Whether the path writes into a product's {@code metafields}. */
    public boolean isMetafieldPath() {
        PathSegment first = segments.get(0);
        return first.getKind() == PathSegment.Kind.KEY && METAFIELDS.equals(first.getKey());
    }

    /**
     * The {@code <namespace>.<key>} addressed by {@code metafields[].<namespace>.<key>}
     * or {@code metafields.<namespace>.<key>}, null for any other path.
     */
    public String metafieldKey() {
        if (!isMetafieldPath()) {
            return null;
        }
        int start = segments.size() > 1 && segments.get(1).getKind() == PathSegment.Kind.EACH ? 2 : 1;
        if (segments.size() != start + 2) {
            return null;
        }
        PathSegment namespace = segments.get(start);
        PathSegment key = segments.get(start + 1);
        if (namespace.getKind() != PathSegment.Kind.KEY || key.getKind() != PathSegment.Kind.KEY) {
            return null;
        }
        return namespace.getKey() + "." + key.getKey();
    }

    /**
     * Canonical form with every index replaced by {@code []}, used to compare a
     * mapped target path against a required field.
     */
    public String normalized() {
        StringBuilder sb = new StringBuilder();
        for (PathSegment segment : segments) {
            if (segment.getKind() == PathSegment.Kind.KEY) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(segment.getKey());
            } else {
                sb.append("[]");
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldPath && ((FieldPath) o).segments.equals(segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
