package com.portfoliorisk.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation {

    private String category;
    private String priority;
    private String message;
    private String metric;
    private List<String> symbols;
    private List<String> suggestedActions;
}
