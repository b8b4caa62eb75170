package uk.gegc.examgen.features.ai.infra.linker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.examgen.features.ai.domain.model.LinkMismatch;
import uk.gegc.examgen.features.ai.domain.model.LinkResult;
import uk.gegc.examgen.features.content.domain.model.Asset;
import uk.gegc.examgen.features.content.domain.model.AssetType;
import uk.gegc.examgen.features.content.domain.model.Question;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Binds questions of one generation unit to the asset generated with them. A question whose
 * reference does not name that asset, or whose variant cannot point at that kind of asset,
 * is excluded and reported; the rest of the batch is kept.
 */
@Slf4j
@Component
public class CrossReferenceLinker {

    public LinkResult link(Asset asset, List<Question> candidates) {
        String assetId = asset.getAssetId();
        List<Question> linked = new ArrayList<>();
        List<LinkMismatch> mismatches = new ArrayList<>();

        for (Question question : candidates) {
            Optional<AssetType> targetType = question.referencedAssetType();
            String reference = question.referencedAssetId().orElse(null);
            String problem = null;
            if (targetType.isEmpty()) {
                problem = question.getQuestionType() + " questions do not reference an asset";
            } else if (targetType.get() != asset.getAssetType()) {
                problem = question.getQuestionType() + " questions reference " + targetType.get()
                        + " assets, not " + asset.getAssetType();
            } else if (reference == null || !reference.equals(assetId)) {
                problem = "reference '" + reference + "' does not match asset '" + assetId + "'";
            }

            if (problem == null) {
                linked.add(question);
            } else {
                log.warn("Cross-reference mismatch, excluding question: {}", problem);
                mismatches.add(new LinkMismatch(question, reference, assetId, problem));
            }
        }

        log.debug("Linked {} of {} questions to asset {}", linked.size(), candidates.size(), assetId);
        return new LinkResult(linked, mismatches);
    }
}
