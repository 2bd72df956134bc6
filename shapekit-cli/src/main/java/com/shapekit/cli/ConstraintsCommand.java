package com.shapekit.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shapekit.core.codegen.CodegenSettings;
import com.shapekit.core.codegen.CodegenTarget;
import com.shapekit.core.codegen.JavaSymbolProvider;
import com.shapekit.core.constraint.ConstraintAnalyzer;
import com.shapekit.core.constraint.ConstraintClassifier;
import com.shapekit.core.constraint.ConstraintPolicy;
import com.shapekit.core.fixture.ModelFixtures;
import com.shapekit.core.fixture.Protocol;
import com.shapekit.core.model.ShapeConstraintReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import software.amazon.smithy.model.Model;
import software.amazon.smithy.model.node.ExpectationNotMetException;
import software.amazon.smithy.model.shapes.ServiceShape;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.validation.ValidatedResultException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to classify the shapes of a model and report constraint reachability.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Table of every shape as seen by the server
 * shapekit constraints model/main.smithy
 *
 * # Only constrained shapes, as JSON
 * shapekit constraints model/main.smithy --only-constrained --json
 *
 * # Re-annotate the service before analysis
 * shapekit constraints model/main.smithy --protocol restXml --service example#Weather
 * }</pre>
 */
@Command(
    name = "constraints",
    description = "Classify shapes and report which can reach a constrained shape",
    mixinStandardHelpOptions = true
)
public class ConstraintsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConstraintsCommand.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    @Parameters(arity = "1..*", description = "Smithy model files (IDL or JSON AST)")
    private List<Path> modelFiles;

    @Option(names = {"-t", "--target"}, description = "Code generation target: ${COMPLETION-CANDIDATES}",
        defaultValue = "SERVER")
    private CodegenTarget target;

    @Option(names = {"-p", "--protocol"}, description = "Protocol to apply to the service before analysis")
    private String protocol;

    @Option(names = {"-s", "--service"}, description = "Service the protocol is applied to (default: the only service)")
    private String service;

    @Option(names = "--only-constrained", description = "Only report shapes that can reach a constrained shape")
    private boolean onlyConstrained;

    @Option(names = "--json", description = "Print the report as JSON")
    private boolean json;

    @Override
    public Integer call() {
        for (Path file : modelFiles) {
            if (!Files.isRegularFile(file)) {
                log.error("Model file not found: {}", file);
                return 1;
            }
        }

        Model model;
        try {
            model = ModelFixtures.assemble(modelFiles);
            if (protocol != null) {
                model = ModelFixtures.replaceProtocolTrait(model, serviceId(model), Protocol.fromName(protocol));
            }
        } catch (ValidatedResultException e) {
            log.error("Model is invalid: {}", e.getMessage());
            return 1;
        } catch (IllegalArgumentException | ExpectationNotMetException e) {
            log.error(e.getMessage());
            return 1;
        }

        JavaSymbolProvider symbolProvider = new JavaSymbolProvider(model,
            CodegenSettings.defaults(CodegenSettings.DEFAULT_ROOT_PACKAGE), target);
        ConstraintClassifier classifier = new ConstraintClassifier(symbolProvider, ConstraintPolicy.forTarget(target));
        List<ShapeConstraintReport> reports = ConstraintAnalyzer.analyze(model, classifier).stream()
            .filter(report -> !onlyConstrained || report.reachesConstrained())
            .toList();

        if (json) {
            try {
                System.out.println(JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(reports));
            } catch (JsonProcessingException e) {
                log.error("Failed to serialize report: {}", e.getMessage());
                return 1;
            }
        } else {
            printTable(reports);
        }
        return 0;
    }

    private ShapeId serviceId(Model model) {
        if (service != null) {
            return ShapeId.from(service);
        }
        List<ShapeId> services = model.getServiceShapes().stream().map(ServiceShape::getId).toList();
        if (services.size() != 1) {
            throw new IllegalArgumentException("--service is required when the model has " + services.size() + " services");
        }
        return services.get(0);
    }

    private void printTable(List<ShapeConstraintReport> reports) {
        System.out.printf("Constraint report (%s):%n%n", target.name().toLowerCase());
        if (reports.isEmpty()) {
            System.out.println("  No shapes to report.");
            return;
        }
        int width = reports.stream().mapToInt(report -> report.shapeId().length()).max().orElse(10);
        String format = "  %-" + width + "s  %-10s  %-8s  %-9s  %s%n";
        System.out.printf(format, "SHAPE", "TYPE", "DIRECT", "REACHES", "TRAITS");
        for (ShapeConstraintReport report : reports) {
            System.out.printf(format,
                report.shapeId(),
                report.shapeType(),
                report.directlyConstrained() ? "yes" : "no",
                report.reachesConstrained() ? "yes" : "no",
                String.join(", ", report.traitKinds()));
        }
        System.out.println();
        System.out.printf("  %d shape(s), %d directly constrained, %d reaching a constrained shape%n",
            reports.size(),
            reports.stream().filter(ShapeConstraintReport::directlyConstrained).count(),
            reports.stream().filter(ShapeConstraintReport::reachesConstrained).count());
    }
}
