package com.vtb.supplychain.pipeline;

import com.vtb.supplychain.models.Ecosystem;
import com.vtb.supplychain.models.Finding;
import com.vtb.supplychain.models.FindingType;
import com.vtb.supplychain.models.PackageIdentity;
import com.vtb.supplychain.models.Severity;
import com.vtb.supplychain.models.SynthesisResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Локальный синтез итогов без внешних вызовов. Используется, когда исполнитель
 * синтеза не уложился во время, упал или вернул некорректный результат.
 */
@Slf4j
public class FallbackSynthesizer {

    static final List<String> GENERAL_RECOMMENDATIONS = List.of(
        "Встройте сканирование зависимостей в CI/CD, чтобы находить проблемы на ранних этапах.",
        "Ведите SBOM (Software Bill of Materials) для контроля состава зависимостей.",
        "Регулярно обновляйте зависимости и отслеживайте бюллетени безопасности.",
        "Фиксируйте версии зависимостей и используйте lock-файлы для воспроизводимых сборок.",
        "Введите политику согласования новых зависимостей."
    );

    public SynthesisResult synthesize(Collection<Finding> findings, Collection<PackageIdentity> packages) {
        try {
            return doSynthesize(
                findings != null ? findings : List.of(),
                packages != null ? packages : List.of());
        } catch (RuntimeException e) {
            log.error("Сбой локального синтеза, возвращается минимальный результат: {}", e.getMessage(), e);
            return minimal(packages);
        }
    }

    private SynthesisResult doSynthesize(Collection<Finding> findings, Collection<PackageIdentity> packages) {
        Counts counts = count(findings);

        Set<Ecosystem> ecosystems = new LinkedHashSet<>();
        for (PackageIdentity pkg : packages) {
            if (pkg != null && pkg.getEcosystem() != Ecosystem.OTHER) {
                ecosystems.add(pkg.getEcosystem());
            }
        }

        SynthesisResult.SeveritySummary summary = SynthesisResult.SeveritySummary.builder()
            .totalPackages(packages.size())
            .totalFindings(counts.total)
            .criticalFindings(counts.critical)
            .highFindings(counts.high)
            .mediumFindings(counts.medium)
            .lowFindings(counts.low)
            .ecosystems(new ArrayList<>(ecosystems))
            .build();

        SynthesisResult result = SynthesisResult.builder()
            .source(SynthesisResult.Source.FALLBACK)
            .summary(summary)
            .riskAssessment(assessRisk(counts))
            .recommendations(recommendations(counts))
            .generatedAt(Instant.now())
            .build();
        log.info("Локальный синтез: риск {} ({} находок, {} пакетов)",
            result.getRiskAssessment().getOverallRisk(), counts.total, packages.size());
        return result;
    }

    SynthesisResult.RiskAssessment assessRisk(Counts counts) {
        Severity level;
        double score;
        String reasoning;
        if (counts.malicious > 0 || counts.critical > 0) {
            level = Severity.CRITICAL;
            score = 0.9 + counts.critical * 0.01 + counts.malicious * 0.05;
            reasoning = String.format("Обнаружено вредоносных пакетов: %d, критических находок: %d",
                counts.malicious, counts.critical);
        } else if (counts.high > 2) {
            level = Severity.HIGH;
            score = 0.7 + counts.high * 0.02;
            reasoning = String.format("Обнаружено находок высокой критичности: %d", counts.high);
        } else if (counts.high > 0 || counts.medium > 3) {
            level = Severity.MEDIUM;
            score = 0.5 + counts.high * 0.05 + counts.medium * 0.01;
            reasoning = String.format("Обнаружено находок высокой критичности: %d, средней: %d",
                counts.high, counts.medium);
        } else {
            level = Severity.LOW;
            score = 0.3;
            reasoning = "Критических и высоких рисков не обнаружено";
        }
        return SynthesisResult.RiskAssessment.builder()
            .overallRisk(level)
            .riskScore(Math.min(score, 1.0))
            .reasoning(reasoning)
            .build();
    }

    private List<String> recommendations(Counts counts) {
        List<String> recommendations = new ArrayList<>();
        if (counts.critical > 0) {
            recommendations.add(String.format(
                "СРОЧНО: устраните критические находки (%d). Они могут указывать на активную угрозу.",
                counts.critical));
        }
        if (counts.malicious > 0) {
            recommendations.add(String.format(
                "Немедленно удалите вредоносные пакеты (%d), проверьте системы на признаки компрометации "
                    + "и пересмотрите все зависимости.", counts.malicious));
        }
        if (counts.high > 0) {
            recommendations.add(String.format(
                "Обновите пакеты с известными уязвимостями (%d) до исправленных версий "
                    + "с приоритетом по критичности и эксплуатируемости.", counts.high));
        }
        recommendations.addAll(GENERAL_RECOMMENDATIONS);
        return recommendations;
    }

    static Counts count(Collection<Finding> findings) {
        Counts counts = new Counts();
        Set<String> maliciousPackages = new HashSet<>();
        for (Finding finding : findings) {
            if (finding == null) {
                continue;
            }
            counts.total++;
            Severity severity = finding.getSeverity() != null ? finding.getSeverity() : Severity.LOW;
            switch (severity) {
                case CRITICAL -> counts.critical++;
                case HIGH -> counts.high++;
                case MEDIUM -> counts.medium++;
                default -> counts.low++;
            }
            if (finding.getFindingType() == FindingType.MALICIOUS_PACKAGE
                || finding.getFindingType() == FindingType.MALICIOUS_SCRIPT) {
                maliciousPackages.add(finding.packageIdentity());
            }
        }
        counts.malicious = maliciousPackages.size();
        return counts;
    }

    private SynthesisResult minimal(Collection<PackageIdentity> packages) {
        return SynthesisResult.builder()
            .source(SynthesisResult.Source.FALLBACK)
            .summary(SynthesisResult.SeveritySummary.builder()
                .totalPackages(packages != null ? packages.size() : 0)
                .build())
            .riskAssessment(SynthesisResult.RiskAssessment.builder()
                .overallRisk(Severity.LOW)
                .riskScore(0.3)
                .reasoning("Оценка риска недоступна")
                .confidence(0.0)
                .build())
            .recommendations(new ArrayList<>(GENERAL_RECOMMENDATIONS))
            .generatedAt(Instant.now())
            .build();
    }

    static final class Counts {
        int total;
        int critical;
        int high;
        int medium;
        int low;
        int malicious;
    }
}
