// Part of Watchdigest
package com.machinezoo.watchdigest;

import java.lang.invoke.*;
import java.lang.reflect.*;
import java.util.*;
import com.google.common.reflect.TypeToken;

/*
 * Resolved form of FieldSelector for one particular object.
 * All validation happens here when the reader is created, so that a digest never discovers
 * that a selector makes no sense for the watched object.
 *
 * Named fields are resolved in this order: map key, accessor method name(), getter getName() or isName(),
 * public field. Only public members reachable via public lookup are considered.
 */
abstract class FieldReader {
	abstract Object read(Object target);
	static FieldReader of(FieldSelector selector, Object target) {
		switch (selector.kind()) {
		case IDENTITY:
			return new IdentityReader();
		case ITEMS:
			if (target instanceof Iterable)
				return new IdentityReader();
			if (target instanceof Object[])
				return new ArrayReader();
			throw new InvalidFieldSelectorException(selector, "Cannot watch items of " + describe(target) + ". Expected Iterable or object array.");
		case ENTRIES:
			if (target instanceof Map)
				return new IdentityReader();
			throw new InvalidFieldSelectorException(selector, "Cannot watch entries of " + describe(target) + ". Expected Map.");
		case FIELD:
			return field(selector, target);
		default:
			throw new IllegalStateException();
		}
	}
	private static String describe(Object target) {
		return target == null ? "null" : target.getClass().getName();
	}
	private static FieldReader field(FieldSelector selector, Object target) {
		String name = selector.name();
		if (target == null)
			throw new InvalidFieldSelectorException(selector, "Cannot watch field '" + name + "' of null.");
		if (target instanceof Map)
			return new KeyReader(name);
		Class<?> type = target.getClass();
		String capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
		for (String candidate : Arrays.asList(name, "get" + capitalized, "is" + capitalized)) {
			Method method;
			try {
				method = type.getMethod(candidate);
			} catch (NoSuchMethodException ex) {
				continue;
			}
			if (Modifier.isStatic(method.getModifiers()) || method.getReturnType() == void.class)
				continue;
			return new HandleReader(unreflect(selector, type, method));
		}
		Field field;
		try {
			field = type.getField(name);
		} catch (NoSuchFieldException ex) {
			throw new InvalidFieldSelectorException(selector, "Class " + type.getName() + " has no public accessor for field '" + name + "'.", ex);
		}
		if (Modifier.isStatic(field.getModifiers()))
			throw new InvalidFieldSelectorException(selector, "Field " + field + " is static.");
		try {
			return new HandleReader(MethodHandles.publicLookup().unreflectGetter(field));
		} catch (IllegalAccessException ex) {
			throw new InvalidFieldSelectorException(selector, "Field " + field + " is not accessible.", ex);
		}
	}
	/*
	 * Public methods of non-public classes (JDK collection implementations, objects handed out behind an interface)
	 * cannot be unreflected with public lookup. The same method is then looked up on public supertypes.
	 * The resulting handle dispatches virtually, so it still invokes the concrete implementation.
	 */
	private static MethodHandle unreflect(FieldSelector selector, Class<?> type, Method method) {
		MethodHandles.Lookup lookup = MethodHandles.publicLookup();
		try {
			return lookup.unreflect(method);
		} catch (IllegalAccessException ex) {
			for (Class<?> supertype : TypeToken.of(type).getTypes().rawTypes()) {
				if (!Modifier.isPublic(supertype.getModifiers()))
					continue;
				Method inherited;
				try {
					inherited = supertype.getMethod(method.getName());
				} catch (NoSuchMethodException missing) {
					continue;
				}
				try {
					return lookup.unreflect(inherited);
				} catch (IllegalAccessException inaccessible) {
					ex.addSuppressed(inaccessible);
				}
			}
			throw new InvalidFieldSelectorException(selector, "Method " + method + " is not accessible.", ex);
		}
	}
	private static class IdentityReader extends FieldReader {
		@Override
		Object read(Object target) {
			return target;
		}
	}
	private static class ArrayReader extends FieldReader {
		@Override
		Object read(Object target) {
			return Arrays.asList((Object[])target);
		}
	}
	private static class KeyReader extends FieldReader {
		private final String key;
		KeyReader(String key) {
			this.key = key;
		}
		@Override
		Object read(Object target) {
			return ((Map<?, ?>)target).get(key);
		}
	}
	private static class HandleReader extends FieldReader {
		private final MethodHandle handle;
		HandleReader(MethodHandle handle) {
			this.handle = handle;
		}
		@Override
		Object read(Object target) {
			try {
				return handle.invoke(target);
			} catch (Throwable ex) {
				throw Failures.propagate(ex);
			}
		}
	}
}
