package com.company.placeholder.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MaterializationResult {
    TimeInferenceResult timeInference;
    BatchResult batchResult;
}
