package com.al.shopsync.dto;

import com.al.shopsync.model.FieldMapping;
import com.al.shopsync.model.enums.SyncMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Sync of an explicit list of source ids. Without a mapping the stored mapping
 * of the entity type is used.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncRequest {

    @NotEmpty
    private List<String> ids;

    @Valid
    private List<FieldMapping> mapping;

    @NotNull
    private SyncMode mode = SyncMode.UPSERT;
}
