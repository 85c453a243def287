/* (C)2026 */
package com.ammann.biometrics.dto;

import com.ammann.biometrics.model.AnalysisWindow;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Pairwise Pearson correlations between daily biomarker series.
 *
 * @param window     analysed window
 * @param biomarkers row and column order
 * @param matrix     {@code matrix.get(a).get(b)} is r(a, b); {@code null} when too few pairs or undefined
 */
@Schema(description = "Pairwise-complete correlation matrix over the daily grid")
public record CorrelationMatrixDTO(
        @Schema(description = "Analysed window") AnalysisWindow window,
        @Schema(description = "Biomarkers in row and column order") List<String> biomarkers,
        @Schema(description = "Correlation per biomarker pair, null where undefined")
                Map<String, Map<String, Double>> matrix) {}
