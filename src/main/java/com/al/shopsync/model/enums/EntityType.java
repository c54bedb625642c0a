package com.al.shopsync.model.enums;

import com.al.shopsync.model.RequiredField;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Entity kinds that can be migrated, with everything the sync needs to know
 * about how each kind looks on the Shopware 5 side and on the Shopify side.
 *
 * <p>
 * Orders are read-only on the target: only {@link SyncMode#UPSERT} is
 * accepted and it never writes, it only matches.
 */
public enum EntityType {

    ARTICLES("articles", "Articles", "Products",
            "articles", "products", "product",
            "mainDetail.number", "variants[].sku", false,
            EnumSet.allOf(SyncMode.class),
            List.of(
                    RequiredField.required("title", SyncMode.CREATE, SyncMode.UPSERT),
                    RequiredField.required("variants[].price", SyncMode.CREATE, SyncMode.UPDATE, SyncMode.UPSERT),
                    RequiredField.requiredWithWarning("variants[].sku",
                            EnumSet.of(SyncMode.UPDATE, SyncMode.UPSERT), EnumSet.of(SyncMode.CREATE)))),

    CUSTOMERS("customers", "Customers", "Customers",
            "customers", "customers", "customer",
            "email", "email", false,
            EnumSet.allOf(SyncMode.class),
            List.of(
                    RequiredField.requiredWithWarning("email",
                            EnumSet.of(SyncMode.UPDATE, SyncMode.UPSERT), EnumSet.of(SyncMode.CREATE)))),

    ORDERS("orders", "Orders", "Orders",
            "orders", "orders", "order",
            "number", "name", true,
            EnumSet.of(SyncMode.UPSERT),
            List.of());

    private final String value;
    private final String sourceLabel;
    private final String targetLabel;
    private final String sourceResource;
    private final String targetResource;
    private final String targetSingular;
    private final String naturalKeyPath;
    private final String targetKeyPath;
    private final boolean targetReadOnly;
    private final Set<SyncMode> supportedModes;
    private final List<RequiredField> requiredFields;

    EntityType(String value, String sourceLabel, String targetLabel,
            String sourceResource, String targetResource, String targetSingular,
            String naturalKeyPath, String targetKeyPath, boolean targetReadOnly,
            Set<SyncMode> supportedModes, List<RequiredField> requiredFields) {
        this.value = value;
        this.sourceLabel = sourceLabel;
        this.targetLabel = targetLabel;
        this.sourceResource = sourceResource;
        this.targetResource = targetResource;
        this.targetSingular = targetSingular;
        this.naturalKeyPath = naturalKeyPath;
        this.targetKeyPath = targetKeyPath;
        this.targetReadOnly = targetReadOnly;
        this.supportedModes = supportedModes;
        this.requiredFields = requiredFields;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getSourceLabel() {
        return sourceLabel;
    }

    public String getTargetLabel() {
        return targetLabel;
    }

    /** Resource name in the Shopware 5 REST API, e.g. {@code articles}. */
    public String getSourceResource() {
        return sourceResource;
    }

    /** Resource name in the Shopify admin API, e.g. {@code products}. */
    public String getTargetResource() {
        return targetResource;
    }

    /** Root key wrapping a single record in Shopify payloads, e.g. {@code product}. */
    public String getTargetSingular() {
        return targetSingular;
    }

    /** Default path of the natural key inside a source record. */
    public String getNaturalKeyPath() {
        return naturalKeyPath;
    }

    /** Path of the natural key inside a mapped (target-shaped) record. */
    public String getTargetKeyPath() {
        return targetKeyPath;
    }

    public boolean isTargetReadOnly() {
        return targetReadOnly;
    }

    public Set<SyncMode> getSupportedModes() {
        return supportedModes;
    }

    public boolean supports(SyncMode mode) {
        return supportedModes.contains(mode);
    }

    public List<RequiredField> getRequiredFields() {
        return requiredFields;
    }

    @JsonCreator
    public static EntityType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value == null ? "" : value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity type: " + value));
    }
}
