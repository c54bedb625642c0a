package com.al.shopsync.dto;

import com.al.shopsync.model.FieldMapping;
import com.al.shopsync.model.enums.SyncMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncAllRequest {

    @Valid
    private List<FieldMapping> mapping;

    @NotNull
    private SyncMode mode = SyncMode.UPSERT;
}
