package uk.gegc.examgen.features.ai.infra.parser;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.content.domain.model.QuestionType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves a question discriminator to its parser. Every {@link QuestionType} has exactly one.
 */
@Component
@Slf4j
public class QuestionParserFactory {
    private final Map<QuestionType, QuestionNodeParser> parserMap = new EnumMap<>(QuestionType.class);

    public QuestionParserFactory(List<QuestionNodeParser> parsers) {
        log.info("Initializing QuestionParserFactory with {} parsers", parsers.size());

        parsers.forEach(parser -> parserMap.put(parser.supportedType(), parser));

        log.info("QuestionParserFactory initialized with parsers for types: {}", parserMap.keySet());
    }

    public QuestionNodeParser getParser(QuestionType type) {
        QuestionNodeParser parser = parserMap.get(type);
        if (parser == null) {
            throw new UnsupportedOperationException("No parser for type " + type);
        }
        return parser;
    }
}
