package com.vtb.supplychain.graph;

import com.vtb.supplychain.models.Severity;
import lombok.Value;

import java.util.List;

@Value
public class VersionConflict {
    String packageName;
    List<String> versions;
    Severity severity;

    public VersionConflict(String packageName, List<String> versions) {
        this.packageName = packageName;
        this.versions = List.copyOf(versions);
        this.severity = Severity.MEDIUM;
    }

    public String describe() {
        return "Конфликт версий '" + packageName + "': " + String.join(", ", versions);
    }
}
