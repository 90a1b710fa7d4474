package uk.gegc.adaptivequiz.features.oracle.infra.catalog;

import org.springframework.stereotype.Component;
import uk.gegc.adaptivequiz.features.oracle.domain.model.MathConcept;
import uk.gegc.adaptivequiz.features.session.domain.model.Topic;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in concept plans used when the oracle cannot plan concepts.
 */
@Component
public class TopicConceptCatalog {

    private final Map<Topic, List<MathConcept>> concepts = new EnumMap<>(Topic.class);

    public TopicConceptCatalog() {
        concepts.put(Topic.ALGEBRA, List.of(
                new MathConcept("Basic Operations", "Addition, subtraction, multiplication, division.", 1),
                new MathConcept("Solving Linear Equations", "Equations with one variable.", 2),
                new MathConcept("Factoring Simple Polynomials", "Factoring expressions like x^2 + bx + c.", 3),
                new MathConcept("Systems of Two Equations", "Solving two linear equations simultaneously.", 4),
                new MathConcept("Quadratic Equations", "Solving equations of the form ax^2 + bx + c = 0.", 5)
        ));
        concepts.put(Topic.CALCULUS, List.of(
                new MathConcept("Limits", "Understanding limits of functions.", 1),
                new MathConcept("Basic Derivatives", "Derivatives of simple power functions.", 2),
                new MathConcept("Chain Rule", "Applying the chain rule for derivatives.", 3),
                new MathConcept("Basic Integrals", "Indefinite integrals of simple functions.", 4),
                new MathConcept("Definite Integrals", "Calculating definite integrals.", 5)
        ));
        concepts.put(Topic.GEOMETRY, List.of(
                new MathConcept("Basic Shapes & Area", "Area of squares, rectangles, triangles.", 1),
                new MathConcept("Perimeter & Circumference", "Perimeter of polygons and circumference of circles.", 2),
                new MathConcept("Angles & Lines", "Parallel lines, transversals and angles.", 3),
                new MathConcept("Pythagorean Theorem", "Applying the theorem to right triangles.", 4),
                new MathConcept("Volume of 3D Shapes", "Volume of prisms, cylinders, spheres.", 5)
        ));
        concepts.put(Topic.STATISTICS, List.of(
                new MathConcept("Mean, Median, Mode", "Measures of central tendency.", 1),
                new MathConcept("Range & Variance", "Measures of spread.", 2),
                new MathConcept("Probability of Events", "Calculating simple probabilities.", 3),
                new MathConcept("Normal Distribution Basics", "The normal curve and standard deviation.", 4),
                new MathConcept("Correlation & Regression", "Relationships between variables.", 5)
        ));
        concepts.put(Topic.BASIC_ARITHMETIC, List.of(
                new MathConcept("Addition & Subtraction", "Operations with whole numbers.", 1),
                new MathConcept("Multiplication & Division", "Operations with whole numbers.", 2),
                new MathConcept("Fractions & Decimals", "Basic operations and conversions.", 3),
                new MathConcept("Percentages", "Finding parts of a whole.", 4),
                new MathConcept("Order of Operations", "Multi-step expressions.", 5)
        ));
    }

    public List<MathConcept> conceptsFor(Topic topic) {
        return concepts.get(topic);
    }
}
