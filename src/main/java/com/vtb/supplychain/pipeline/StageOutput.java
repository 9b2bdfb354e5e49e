package com.vtb.supplychain.pipeline;

import com.vtb.supplychain.models.Finding;
import com.vtb.supplychain.models.SynthesisResult;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class StageOutput {

    @Builder.Default
    private List<Finding> findings = new ArrayList<>();
    private SynthesisResult synthesis;

    public static StageOutput of(List<Finding> findings) {
        return StageOutput.builder()
            .findings(findings != null ? new ArrayList<>(findings) : new ArrayList<>())
            .build();
    }

    public static StageOutput empty() {
        return StageOutput.builder().build();
    }

    public static StageOutput synthesis(SynthesisResult synthesis) {
        return StageOutput.builder().synthesis(synthesis).build();
    }
}
