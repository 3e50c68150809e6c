package works.arbor.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;

/**
 * Orders the heterogeneous values found in table cells.
 * <p>
 * Nulls always sort last, whichever the direction.
 * Otherwise cells are ranked by kind first: numbers, then strings, then everything else
 * grouped by class name. Only cells of the same kind are compared by value:
 * numbers by magnitude regardless of their boxed type, strings lexically,
 * same-class {@link Comparable}s by their natural order, and anything else by {@link Object#toString()}.
 * A column mixing {@code 9} and {@code "9"} therefore still has a consistent order.
 */
public final class CellComparator implements Comparator<Object> {
	public static final CellComparator ASCENDING = new CellComparator(false);
	public static final CellComparator DESCENDING = new CellComparator(true);

	private final boolean descending;

	private CellComparator(boolean descending) {
		this.descending = descending;
	}

	@Override
	public int compare(Object left, Object right) {
		if (left == null) {
			return (right == null) ? 0 : 1;
		} else if (right == null) {
			return -1;
		}
		int result = compareValues(left, right);
		return descending ? -result : result;
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	private static int compareValues(Object left, Object right) {
		int byKind = Integer.compare(kind(left), kind(right));
		if (byKind != 0) {
			return byKind;
		}
		if (left instanceof Number l && right instanceof Number r) {
			return compareNumbers(l, r);
		} else if (left instanceof String l && right instanceof String r) {
			return l.compareTo(r);
		}
		int byClass = left.getClass().getName().compareTo(right.getClass().getName());
		if (byClass != 0) {
			return byClass;
		} else if (left instanceof Comparable c) {
			return c.compareTo(right);
		} else {
			return left.toString().compareTo(right.toString());
		}
	}

	private static int kind(Object value) {
		if (value instanceof Number) {
			return 0;
		} else if (value instanceof String) {
			return 1;
		} else {
			return 2;
		}
	}

	private static int compareNumbers(Number left, Number right) {
		if (isExact(left) && isExact(right)) {
			return toBigDecimal(left).compareTo(toBigDecimal(right));
		} else {
			return Double.compare(left.doubleValue(), right.doubleValue());
		}
	}

	private static boolean isExact(Number n) {
		if (n instanceof Double d) {
			return Double.isFinite(d);
		} else if (n instanceof Float f) {
			return Float.isFinite(f);
		} else {
			return true;
		}
	}

	private static BigDecimal toBigDecimal(Number n) {
		if (n instanceof BigDecimal b) {
			return b;
		} else if (n instanceof BigInteger b) {
			return new BigDecimal(b);
		} else if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
			return BigDecimal.valueOf(n.longValue());
		} else {
			return new BigDecimal(n.toString());
		}
	}
}
