package com.al.shopsync.model;

import com.al.shopsync.model.enums.SyncMode;
import lombok.Value;

import java.util.EnumSet;
import java.util.Set;

/**
 * A target field that must (or should) be populated by the mapping for a given
 * sync mode.
 */
@Value
public class RequiredField {
    String path;
    Set<SyncMode> requiredIn;
    Set<SyncMode> recommendedIn;

    public static RequiredField required(String path, SyncMode first, SyncMode... rest) {
        return new RequiredField(path, EnumSet.of(first, rest), EnumSet.noneOf(SyncMode.class));
    }

    public static RequiredField requiredWithWarning(String path, Set<SyncMode> requiredIn, Set<SyncMode> recommendedIn) {
        return new RequiredField(path, EnumSet.copyOf(requiredIn), EnumSet.copyOf(recommendedIn));
    }

    public boolean isRequiredFor(SyncMode mode) {
        return requiredIn.contains(mode);
    }

    public boolean isRecommendedFor(SyncMode mode) {
        return recommendedIn.contains(mode);
    }
}
