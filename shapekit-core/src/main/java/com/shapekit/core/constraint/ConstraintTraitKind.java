package com.shapekit.core.constraint;

import software.amazon.smithy.model.shapes.Shape;
import software.amazon.smithy.model.traits.DefaultTrait;
import software.amazon.smithy.model.traits.EnumTrait;
import software.amazon.smithy.model.traits.ErrorTrait;
import software.amazon.smithy.model.traits.LengthTrait;
import software.amazon.smithy.model.traits.PatternTrait;
import software.amazon.smithy.model.traits.RangeTrait;
import software.amazon.smithy.model.traits.RequiredTrait;
import software.amazon.smithy.model.traits.Trait;
import software.amazon.smithy.model.traits.UniqueItemsTrait;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of trait kinds that take part in constraint analysis.
 *
 * <p>Each kind is bound to the Smithy trait class that carries it. Policy tables and the
 * classifier switch over this enum, so adding a kind forces every switch to be revisited.
 *
 * <ul>
 *   <li>{@link #LENGTH}, {@link #RANGE}, {@link #PATTERN}, {@link #UNIQUE_ITEMS} and
 *       {@link #ENUM} are type-level constraints: they apply to every use of the shape.</li>
 *   <li>{@link #REQUIRED} and {@link #DEFAULT} are member-level and describe the edge from a
 *       structure to one of its members.</li>
 *   <li>{@link #ERROR} marks error structures and never constrains anything.</li>
 * </ul>
 */
public enum ConstraintTraitKind {
    LENGTH(LengthTrait.class),
    RANGE(RangeTrait.class),
    PATTERN(PatternTrait.class),
    UNIQUE_ITEMS(UniqueItemsTrait.class),
    ENUM(EnumTrait.class),
    REQUIRED(RequiredTrait.class),
    DEFAULT(DefaultTrait.class),
    ERROR(ErrorTrait.class);

    private final Class<? extends Trait> traitClass;

    ConstraintTraitKind(Class<? extends Trait> traitClass) {
        this.traitClass = traitClass;
    }

    /**
     * Returns the Smithy trait class this kind is bound to.
     *
     * @return trait class
     */
    public Class<? extends Trait> traitClass() {
        return traitClass;
    }

    /**
     * Checks whether the shape itself carries this kind of trait.
     *
     * @param shape shape to inspect
     * @return true if the trait is present on the shape
     */
    public boolean isPresentOn(Shape shape) {
        return shape.hasTrait(traitClass);
    }

    /**
     * Returns whether this kind constrains the type it is attached to, as opposed to the
     * relationship between a structure and a member.
     *
     * @return true for type-level constraint kinds
     */
    public boolean isTypeLevel() {
        return switch (this) {
            case LENGTH, RANGE, PATTERN, UNIQUE_ITEMS, ENUM -> true;
            case REQUIRED, DEFAULT, ERROR -> false;
        };
    }

    /**
     * Lists every kind present on a shape.
     *
     * @param shape shape to inspect
     * @return kinds present, in declaration order
     */
    public static Set<ConstraintTraitKind> kindsOf(Shape shape) {
        Set<ConstraintTraitKind> kinds = EnumSet.noneOf(ConstraintTraitKind.class);
        for (ConstraintTraitKind kind : values()) {
            if (kind.isPresentOn(shape)) {
                kinds.add(kind);
            }
        }
        return kinds;
    }
}
