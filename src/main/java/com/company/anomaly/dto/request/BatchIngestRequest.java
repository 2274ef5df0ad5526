package com.company.anomaly.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchIngestRequest {
    @NotEmpty(message = "At least one sample is required")
    @Size(max = 1000, message = "At most 1000 samples per batch")
    private List<MetricSampleRequest> samples;
}
