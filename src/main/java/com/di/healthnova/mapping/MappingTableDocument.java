package com.di.healthnova.mapping;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of {@code canonical-mappings.yml}.
 */
@Data
public class MappingTableDocument {
    private String version;
    private List<FieldMapping> mappings = new ArrayList<>();
}
