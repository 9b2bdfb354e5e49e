package com.vtb.supplychain.pipeline;

import com.vtb.supplychain.models.SynthesisResult;

/**
 * Структурная проверка результата исполнителя синтеза.
 */
public class SynthesisValidator {

    public void validate(SynthesisResult result) throws SynthesisValidationException {
        if (result == null) {
            throw new SynthesisValidationException("этап синтеза не вернул результат");
        }
        SynthesisResult.SeveritySummary summary = result.getSummary();
        if (summary == null) {
            throw new SynthesisValidationException("отсутствует сводка по критичности");
        }
        if (summary.getTotalPackages() < 0
            || summary.getTotalFindings() < 0
            || summary.getCriticalFindings() < 0
            || summary.getHighFindings() < 0
            || summary.getMediumFindings() < 0
            || summary.getLowFindings() < 0) {
            throw new SynthesisValidationException("отрицательные счетчики в сводке");
        }
        SynthesisResult.RiskAssessment risk = result.getRiskAssessment();
        if (risk == null || risk.getOverallRisk() == null) {
            throw new SynthesisValidationException("отсутствует оценка риска проекта");
        }
        if (Double.isNaN(risk.getRiskScore()) || risk.getRiskScore() < 0.0 || risk.getRiskScore() > 1.0) {
            throw new SynthesisValidationException("riskScore вне диапазона [0, 1]: " + risk.getRiskScore());
        }
        if (result.getRecommendations() == null) {
            throw new SynthesisValidationException("отсутствует список рекомендаций");
        }
    }
}
