package com.e2eq.insights.model.analytics;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class TableDescriptor {

    private String tableId;

    private String description;

    private List<String> columns = new ArrayList<>();

    private Long rowCount;
}
