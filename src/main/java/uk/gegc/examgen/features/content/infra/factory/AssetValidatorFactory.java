package uk.gegc.examgen.features.content.infra.factory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.infra.validator.AssetValidator;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class AssetValidatorFactory {
    private final Map<AssetType, AssetValidator<?>> validatorMap = new EnumMap<>(AssetType.class);

    public AssetValidatorFactory(List<AssetValidator<?>> validators) {
        log.info("Initializing AssetValidatorFactory with {} validators", validators.size());

        validators.forEach(validator -> validatorMap.put(validator.supportedType(), validator));

        log.info("AssetValidatorFactory initialized with validators for types: {}", validatorMap.keySet());
    }

    public AssetValidator<?> getValidator(AssetType type) {
        AssetValidator<?> validator = validatorMap.get(type);
        if (validator == null) {
            throw new UnsupportedOperationException("No validator for type " + type);
        }
        return validator;
    }
}
