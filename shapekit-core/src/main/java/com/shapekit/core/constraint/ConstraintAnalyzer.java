package com.shapekit.core.constraint;

import com.shapekit.core.model.ShapeConstraintReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.shapes.Shape;
import software.amazon.smithy.model.shapes.ShapeType;
import software.amazon.smithy.model.traits.TraitDefinition;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Runs classification and reachability over every user-defined shape of a model.
 */
public final class ConstraintAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ConstraintAnalyzer.class);
    private static final String PRELUDE_NAMESPACE = "smithy.api";

    private ConstraintAnalyzer() {
        // Utility class
    }

    /**
     * Analyzes all shapes outside the prelude, excluding members and trait definitions.
     *
     * @param model model to analyze
     * @param classifier classifier to apply
     * @return one report per shape, sorted by shape id
     */
    public static List<ShapeConstraintReport> analyze(Model model, ConstraintClassifier classifier) {
        Objects.requireNonNull(model, "model must not be null");
        ReachabilityAnalyzer reachability = new ReachabilityAnalyzer(model, classifier);

        List<ShapeConstraintReport> reports = model.shapes()
            .filter(shape -> !shape.getId().getNamespace().equals(PRELUDE_NAMESPACE))
            .filter(shape -> shape.getType() != ShapeType.MEMBER)
            .filter(shape -> !shape.hasTrait(TraitDefinition.class))
            .sorted()
            .map(shape -> report(shape, classifier, reachability))
            .toList();

        log.info("Analyzed {} shapes, {} directly constrained", reports.size(),
            reports.stream().filter(ShapeConstraintReport::directlyConstrained).count());
        return reports;
    }

    private static ShapeConstraintReport report(Shape shape, ConstraintClassifier classifier,
                                                ReachabilityAnalyzer reachability) {
        List<String> kinds = ConstraintTraitKind.kindsOf(shape).stream()
            .map(kind -> kind.name().toLowerCase(Locale.ROOT))
            .toList();
        return new ShapeConstraintReport(
            shape.getId().toString(),
            shape.getType().toString(),
            kinds,
            classifier.isDirectlyConstrained(shape),
            reachability.canReachConstrainedShape(shape)
        );
    }
}
