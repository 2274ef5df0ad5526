package com.company.anomaly.dto.response;

import lombok.*;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchIngestResponse {
    private int accepted;
    private int rejected;
    private int anomalies;
    private List<IngestResponse> results;
}
