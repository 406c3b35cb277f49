package com.selectra.scorecard.rubric;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.selectra.scorecard.model.QuestionSpec;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads a {@link Rubric} from JSON and normalises it into immutable lists.
 */
@Slf4j
public final class RubricLoader {

    private final ObjectMapper objectMapper;

    public RubricLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Rubric load(InputStream in) throws IOException {
        Rubric raw = objectMapper.readValue(in, Rubric.class);
        return normalise(raw);
    }

    static Rubric normalise(Rubric raw) {
        if (raw.getQuestions() == null || raw.getQuestions().isEmpty()) {
            throw new IllegalArgumentException("Rubric must define at least one question");
        }

        Set<Integer> seenIds = new HashSet<>();
        List<QuestionSpec> questions = raw.getQuestions().stream()
                .map(q -> {
                    if (!seenIds.add(q.getId())) {
                        throw new IllegalArgumentException("Duplicate question id " + q.getId());
                    }
                    return q.toBuilder().keywords(distinct(q.getKeywords())).build();
                })
                .collect(Collectors.toList());

        Rubric rubric = Rubric.builder()
                .questions(List.copyOf(questions))
                .fillerPhrases(distinct(raw.getFillerPhrases()))
                .assertivePhrases(distinct(raw.getAssertivePhrases()))
                .examplePhrases(distinct(raw.getExamplePhrases()))
                .build();

        log.info("Loaded rubric: {} questions, {} filler, {} assertive, {} example phrases",
                rubric.getQuestions().size(), rubric.getFillerPhrases().size(),
                rubric.getAssertivePhrases().size(), rubric.getExamplePhrases().size());
        return rubric;
    }

    private static List<String> distinct(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return List.copyOf(new LinkedHashSet<>(values));
    }
}
