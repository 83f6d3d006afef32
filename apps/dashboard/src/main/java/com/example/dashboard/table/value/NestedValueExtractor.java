package com.example.dashboard.table.value;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.lang.reflect.Field;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Resolves dotted column keys such as {@code documentStatus.refDataValue} against a row.
 * <p>
 * Each segment is looked up as a map key, a list index, a record component, a JavaBean
 * getter or a public field, in that order. Any missing segment, null intermediate value or
 * non-indexable intermediate value (strings, numbers, dates...) resolves to {@code null}.
 * Lookups never throw.
 */
@Slf4j
public final class NestedValueExtractor {

    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("\\.");
    private static final Pattern INDEX = Pattern.compile("\\d+");

    private static final Map<Class<?>, Map<String, Optional<Member>>> ACCESSORS = new ConcurrentHashMap<>();

    private NestedValueExtractor() {}

    @Nullable
    public static Object extract(@Nullable Object row, @Nullable String path) {
        if (row == null || path == null) {
            return null;
        }
        Object current = row;
        for (String segment : SEGMENT_SEPARATOR.split(path, -1)) {
            current = resolve(current, segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    @Nullable
    private static Object resolve(Object current, String segment) {
        if (current instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (current instanceof List<?> list) {
            return elementAt(list, segment);
        }
        if (!isIndexable(current)) {
            return null;
        }
        return accessorFor(current.getClass(), segment)
                .map(member -> read(member, current))
                .orElse(null);
    }

    @Nullable
    private static Object elementAt(List<?> list, String segment) {
        if (!INDEX.matcher(segment).matches() || segment.length() > 9) {
            return null;
        }
        int index = Integer.parseInt(segment);
        return index < list.size() ? list.get(index) : null;
    }

    private static boolean isIndexable(Object value) {
        return !(value instanceof CharSequence
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Enum<?>
                || value instanceof Date
                || value instanceof TemporalAccessor
                || value.getClass().isArray());
    }

    private static Optional<Member> accessorFor(Class<?> type, String segment) {
        return ACCESSORS
                .computeIfAbsent(type, t -> new ConcurrentHashMap<>())
                .computeIfAbsent(segment, s -> findAccessor(type, s));
    }

    private static Optional<Member> findAccessor(Class<?> type, String name) {
        if (name.isEmpty()) {
            return Optional.empty();
        }
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                if (component.getName().equals(name)) {
                    return accessible(component.getAccessor());
                }
            }
        }
        String capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        Optional<Method> getter = publicNoArgMethod(type, "get" + capitalized)
                .or(() -> publicNoArgMethod(type, "is" + capitalized)
                        .filter(m -> m.getReturnType() == boolean.class || m.getReturnType() == Boolean.class));
        if (getter.isPresent()) {
            return getter.flatMap(NestedValueExtractor::accessible);
        }
        try {
            Field field = type.getField(name);
            if (!Modifier.isStatic(field.getModifiers())) {
                return accessible(field);
            }
        } catch (NoSuchFieldException | SecurityException e) {
            log.trace("No public field {} on {}", name, type.getName());
        }
        return Optional.empty();
    }

    private static Optional<Method> publicNoArgMethod(Class<?> type, String name) {
        try {
            Method method = type.getMethod(name);
            if (Modifier.isStatic(method.getModifiers()) || method.getReturnType() == void.class) {
                return Optional.empty();
            }
            return Optional.of(method);
        } catch (NoSuchMethodException | SecurityException e) {
            return Optional.empty();
        }
    }

    private static Optional<Member> accessible(Method method) {
        method.trySetAccessible();
        return Optional.of(method);
    }

    private static Optional<Member> accessible(Field field) {
        field.trySetAccessible();
        return Optional.of(field);
    }

    @Nullable
    private static Object read(Member member, Object target) {
        try {
            if (member instanceof Method method) {
                return method.invoke(target);
            }
            return ((Field) member).get(target);
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.debug("Could not read {} from {}: {}", member.getName(), target.getClass().getName(), e.toString());
            return null;
        }
    }
}
