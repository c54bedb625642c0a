package com.al.shopsync.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A custom field declared in the target shop, addressed in mappings as
 * {@code metafields[].<namespace>.<key>}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetafieldDefinition {
    private String namespace;
    private String key;
    private String name;
    /** Shopify type name, e.g. {@code single_line_text_field} or {@code list.single_line_text_field} */
    private String type;
    private String description;

    public String qualifiedKey() {
        return namespace + "." + key;
    }

    public boolean isList() {
        return isListType(type);
    }

    public static boolean isListType(String type) {
        return type != null && type.startsWith("list.");
    }
}
