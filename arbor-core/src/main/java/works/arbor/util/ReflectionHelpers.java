package works.arbor.util;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.function.Function;

import static java.lang.invoke.MethodType.methodType;

public final class ReflectionHelpers {
	private static final MethodType READER_TYPE = methodType(Object.class, Object.class);

	private ReflectionHelpers() { }

	/**
	 * Finds the attribute called {@code name} on {@code nodeClass} and returns a function that reads it.
	 * <p>
	 * Candidates are tried in this order:
	 * a record component; a public-or-not zero-argument method called {@code name};
	 * a JavaBeans getter {@code getName} or {@code isName}; an instance field.
	 * Superclasses are searched for methods and fields.
	 *
	 * @throws IllegalArgumentException if there's no such attribute
	 */
	public static Function<Object, Object> attributeReader(Class<?> nodeClass, String name) {
		MethodHandle handle = findAttribute(nodeClass, name).asType(READER_TYPE);
		return node -> {
			try {
				return (Object) handle.invokeExact(node);
			} catch (RuntimeException | Error e) {
				throw e;
			} catch (Throwable e) {
				throw new IllegalStateException("Unable to read attribute \"" + name + "\" of " + nodeClass.getSimpleName(), e);
			}
		};
	}

	private static MethodHandle findAttribute(Class<?> nodeClass, String name) {
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Attribute name can't be empty");
		}
		try {
			if (nodeClass.isRecord()) {
				for (RecordComponent rc : nodeClass.getRecordComponents()) {
					if (rc.getName().equals(name)) {
						return unreflect(rc.getAccessor());
					}
				}
			}
			String capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
			for (String candidate : new String[]{ name, "get" + capitalized, "is" + capitalized }) {
				Method method = findGetter(nodeClass, candidate);
				if (method != null) {
					return unreflect(method);
				}
			}
			Field field = findField(nodeClass, name);
			if (field != null) {
				field.setAccessible(true);
				return MethodHandles.lookup().unreflectGetter(field);
			}
		} catch (IllegalAccessException e) {
			throw new IllegalArgumentException("Attribute \"" + name + "\" of " + nodeClass.getSimpleName() + " is not accessible", e);
		}
		throw new IllegalArgumentException("No attribute \"" + name + "\" on " + nodeClass.getSimpleName());
	}

	private static MethodHandle unreflect(Method method) throws IllegalAccessException {
		method.setAccessible(true);
		return MethodHandles.lookup().unreflect(method);
	}

	private static Method findGetter(Class<?> c, String methodName) {
		for (Class<?> k = c; k != null && k != Object.class; k = k.getSuperclass()) {
			for (Method m : k.getDeclaredMethods()) {
				if (m.getName().equals(methodName)
					&& m.getParameterCount() == 0
					&& m.getReturnType() != void.class
					&& !Modifier.isStatic(m.getModifiers())
					&& !m.isSynthetic()
				) {
					return m;
				}
			}
		}
		// Interface default methods and public inherited methods
		try {
			Method m = c.getMethod(methodName);
			if (m.getReturnType() != void.class && !Modifier.isStatic(m.getModifiers())) {
				return m;
			}
		} catch (NoSuchMethodException e) {
			// Not there; fall through to fields
		}
		return null;
	}

	private static Field findField(Class<?> c, String fieldName) {
		for (Class<?> k = c; k != null && k != Object.class; k = k.getSuperclass()) {
			for (Field f : k.getDeclaredFields()) {
				if (f.getName().equals(fieldName) && !Modifier.isStatic(f.getModifiers())) {
					return f;
				}
			}
		}
		return null;
	}
}
