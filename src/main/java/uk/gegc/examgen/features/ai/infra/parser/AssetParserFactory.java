package uk.gegc.examgen.features.ai.infra.parser;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.content.domain.model.AssetType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class AssetParserFactory {
    private final Map<AssetType, AssetNodeParser> parserMap = new EnumMap<>(AssetType.class);

    public AssetParserFactory(List<AssetNodeParser> parsers) {
        log.info("Initializing AssetParserFactory with {} parsers", parsers.size());

        parsers.forEach(parser -> parserMap.put(parser.supportedType(), parser));

        log.info("AssetParserFactory initialized with parsers for types: {}", parserMap.keySet());
    }

    public AssetNodeParser getParser(AssetType type) {
        AssetNodeParser parser = parserMap.get(type);
        if (parser == null) {
            throw new UnsupportedOperationException("No parser for type " + type);
        }
        return parser;
    }
}
