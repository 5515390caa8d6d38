package io.pacer.standards.scheduler;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Parsed form of one crontab field.
 *
 * A field is one of four shapes: {@link Wildcard} ({@code *}), {@link Single}
 * ({@code 5}), {@link Step} ({@code 1-5}, {@code *}{@code /15}, {@code 10-40/10}) and
 * {@link ListOf} (comma separated elements of the other shapes). Matching is a pure
 * function of the value.
 */
public abstract class CronField
{
    public enum Kind
    {
        WILDCARD,
        SINGLE,
        LIST,
        STEP;
    }

    CronField()
    { }

    public abstract Kind getKind();

    public abstract boolean matches(int value);

    /**
     * True unless the field is a bare {@code *}. A stepped wildcard such as
     * {@code *}{@code /2} is restricted.
     */
    public boolean isRestricted()
    {
        return getKind() != Kind.WILDCARD;
    }

    public static CronField wildcard()
    {
        return Wildcard.INSTANCE;
    }

    public static CronField single(int value)
    {
        return new Single(value);
    }

    public static CronField step(int start, int end, int step)
    {
        return new Step(start, end, step);
    }

    public static CronField range(int start, int end)
    {
        return new Step(start, end, 1);
    }

    public static CronField list(List<CronField> elements)
    {
        return new ListOf(elements);
    }

    public static final class Wildcard
            extends CronField
    {
        private static final Wildcard INSTANCE = new Wildcard();

        private Wildcard()
        { }

        @Override
        public Kind getKind()
        {
            return Kind.WILDCARD;
        }

        @Override
        public boolean matches(int value)
        {
            return true;
        }

        @Override
        public String toString()
        {
            return "*";
        }
    }

    public static final class Single
            extends CronField
    {
        private final int value;

        private Single(int value)
        {
            this.value = value;
        }

        public int getValue()
        {
            return value;
        }

        @Override
        public Kind getKind()
        {
            return Kind.SINGLE;
        }

        @Override
        public boolean matches(int value)
        {
            return this.value == value;
        }

        @Override
        public boolean equals(Object o)
        {
            return o instanceof Single && ((Single) o).value == value;
        }

        @Override
        public int hashCode()
        {
            return Integer.hashCode(value);
        }

        @Override
        public String toString()
        {
            return Integer.toString(value);
        }
    }

    /**
     * Every {@code step}-th value from {@code start} up to {@code end}, both inclusive.
     */
    public static final class Step
            extends CronField
    {
        private final int start;
        private final int end;
        private final int step;

        private Step(int start, int end, int step)
        {
            checkArgument(step > 0, "step must be positive: %s", step);
            checkArgument(start <= end, "range start %s is after end %s", start, end);
            this.start = start;
            this.end = end;
            this.step = step;
        }

        public int getStart()
        {
            return start;
        }

        public int getEnd()
        {
            return end;
        }

        public int getStep()
        {
            return step;
        }

        @Override
        public Kind getKind()
        {
            return Kind.STEP;
        }

        @Override
        public boolean matches(int value)
        {
            return value >= start && value <= end && (value - start) % step == 0;
        }

        @Override
        public boolean equals(Object o)
        {
            if (!(o instanceof Step)) {
                return false;
            }
            Step other = (Step) o;
            return start == other.start && end == other.end && step == other.step;
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(start, end, step);
        }

        @Override
        public String toString()
        {
            if (step == 1) {
                return start + "-" + end;
            }
            return start + "-" + end + "/" + step;
        }
    }

    public static final class ListOf
            extends CronField
    {
        private final List<CronField> elements;

        private ListOf(List<CronField> elements)
        {
            checkArgument(!elements.isEmpty(), "list must not be empty");
            this.elements = ImmutableList.copyOf(elements);
        }

        public List<CronField> getElements()
        {
            return elements;
        }

        @Override
        public Kind getKind()
        {
            return Kind.LIST;
        }

        @Override
        public boolean matches(int value)
        {
            for (CronField element : elements) {
                if (element.matches(value)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public boolean equals(Object o)
        {
            return o instanceof ListOf && ((ListOf) o).elements.equals(elements);
        }

        @Override
        public int hashCode()
        {
            return elements.hashCode();
        }

        @Override
        public String toString()
        {
            return elements.stream().map(CronField::toString).collect(Collectors.joining(","));
        }
    }
}
