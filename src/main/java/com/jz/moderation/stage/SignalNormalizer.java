package com.jz.moderation.stage;

import com.jz.moderation.analyzer.RawCaption;
import com.jz.moderation.analyzer.RawDetection;
import com.jz.moderation.analyzer.RawFace;
import com.jz.moderation.analyzer.RawPose;
import com.jz.moderation.config.ComponentConfig;
import com.jz.moderation.config.DetectionToggle;
import com.jz.moderation.config.ModerationSettings;
import com.jz.moderation.signal.BoundingBox;
import com.jz.moderation.signal.DescriptionSignal;
import com.jz.moderation.signal.DetectionSignal;
import com.jz.moderation.signal.FaceRecord;
import com.jz.moderation.signal.FaceSignal;
import com.jz.moderation.signal.PoseSignal;
import com.jz.moderation.signal.StageStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 把各分析器的原始输出转成带类型的信号。输出不合法时抛 {@link MalformedSignalException}，
 * 由 StageRunner 统一走兜底。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignalNormalizer {

    private final PoseClassifier poseClassifier;
    private final DescriptionTagger tagger;

    public DetectionSignal detections(List<RawDetection> raw, ComponentConfig config) {
        if (raw == null) throw new MalformedSignalException("nudity output is null");

        Map<String, Double> parts = new LinkedHashMap<>();
        Map<String, BoundingBox> locations = new LinkedHashMap<>();
        List<String> filtered = new ArrayList<>();

        for (RawDetection d : raw) {
            if (d == null || d.getLabel() == null || d.getLabel().isBlank()) {
                throw new MalformedSignalException("detection without label");
            }
            Double score = d.getScore();
            if (score == null || score.isNaN() || score < 0) {
                throw new MalformedSignalException("invalid score for " + d.getLabel() + ": " + score);
            }
            String label = d.getLabel().trim().toUpperCase(Locale.ROOT);

            Optional<DetectionToggle> toggle = DetectionToggle.forLabel(label);
            if (toggle.isPresent() && !config.isEnabled(toggle.get())) {
                if (!filtered.contains(label)) filtered.add(label);
                continue;
            }

            double confidence = Math.min(100.0, score * 100.0);
            // 同一标签多次检出取最高
            Double prev = parts.get(label);
            if (prev == null || confidence > prev) {
                parts.put(label, confidence);
                BoundingBox box = toBox(d.getBox(), confidence);
                if (box != null) locations.put(label, box);
                else locations.remove(label);
            }
        }
        if (!filtered.isEmpty()) {
            log.info("Filtered out disabled labels: {} ({} -> {} detections)", filtered, raw.size(), parts.size());
        }
        return DetectionSignal.of(StageStatus.OK, parts, locations, raw.size(), filtered);
    }

    public PoseSignal pose(RawPose raw) {
        return poseClassifier.classify(raw);
    }

    public FaceSignal faces(List<RawFace> raw, ModerationSettings settings) {
        if (raw == null) throw new MalformedSignalException("face output is null");
        List<FaceRecord> records = new ArrayList<>();
        int id = 1;
        for (RawFace f : raw) {
            if (f == null || f.getAge() == null || f.getAge() < 0) {
                throw new MalformedSignalException("face without a valid age estimate");
            }
            double conf = f.getScore() == null || f.getScore().isNaN() ? 0.9 : Math.max(0, Math.min(1, f.getScore()));
            records.add(FaceRecord.builder()
                    .faceId(id++)
                    .age(f.getAge())
                    .gender(gender(f.getGender()))
                    .confidence(conf)
                    .box(toBox(f.getBox(), conf * 100))
                    .build());
        }
        return FaceSignal.of(StageStatus.OK, records,
                settings.getMinAgeThreshold(), settings.getSuspiciousAgeThreshold());
    }

    public DescriptionSignal caption(RawCaption raw, ComponentConfig config, ModerationSettings settings) {
        if (raw == null || raw.getDescription() == null) {
            throw new MalformedSignalException("caption output without description");
        }
        String text = raw.getDescription().trim();
        Set<String> tags = tagger.extractTags(text, raw.getTags(), settings.getTagVocabulary());
        List<String> childHits = config.isChildScanEnabled()
                ? tagger.findChildKeywords(text, tags, settings.getChildKeywords())
                : List.of();
        return DescriptionSignal.builder()
                .status(StageStatus.OK)
                .description(text)
                .tags(Collections.unmodifiableSet(tags))
                .containsChildKeywords(!childHits.isEmpty())
                .childKeywordsFound(List.copyOf(childHits))
                .generationMethod(raw.getMethod() == null ? "caption_model" : raw.getMethod())
                .build();
    }

    private static BoundingBox toBox(List<Double> box, double confidence) {
        if (box == null || box.size() != 4 || box.contains(null)) return null;
        return BoundingBox.fromCorners(box.get(0), box.get(1), box.get(2), box.get(3), confidence);
    }

    private static String gender(String g) {
        if (g == null) return "Unknown";
        return switch (g.trim().toUpperCase(Locale.ROOT)) {
            case "M", "MALE", "1" -> "M";
            case "F", "FEMALE", "0" -> "F";
            default -> "Unknown";
        };
    }
}
