package com.ciro.jdirective.template;

import com.ciro.jdirective.ObjectMapperFactory;
import com.ciro.jdirective.error.ExpressionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Semántica de valores del evaluador: navegación de propiedades, veracidad,
 * comparación, aritmética y conversión a texto.
 */
public final class Values {

    private Values() {}

    // ========================================================================
    // Navegación (Maps, Listas, Arrays, Records, Getters y Fields)
    // ========================================================================

    public static Object property(Object obj, String name) {
        if (obj == null) return null;
        if (obj instanceof Map<?, ?> m) return m.get(name);

        if (name.equals("length") || name.equals("size")) {
            if (obj instanceof Collection<?> || obj instanceof CharSequence || obj.getClass().isArray()) {
                return size(obj);
            }
        }
        if (obj instanceof List<?> || obj.getClass().isArray()) {
            return isIndex(name) ? index(obj, Integer.parseInt(name)) : null;
        }

        Class<?> c = obj.getClass();
        try {
            Method m = findMethod(c, name);
            if (m != null) {
                m.setAccessible(true);
                return m.invoke(obj);
            }
            Field f = findField(c, name);
            if (f != null) {
                f.setAccessible(true);
                return f.get(obj);
            }
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new ExpressionException("Cannot read property '" + name + "' of " + c.getSimpleName(), name, e);
        }
        return null;
    }

    public static Object index(Object obj, Object key) {
        if (obj == null) return null;
        if (obj instanceof Map<?, ?> m) {
            Object v = m.get(key);
            return (v == null && key != null) ? m.get(String.valueOf(key)) : v;
        }
        if (key instanceof Number n) {
            int i = n.intValue();
            if (obj instanceof List<?> l) return (i >= 0 && i < l.size()) ? l.get(i) : null;
            if (obj.getClass().isArray()) return (i >= 0 && i < Array.getLength(obj)) ? Array.get(obj, i) : null;
        }
        if (key instanceof String s) return property(obj, s);
        throw new ExpressionException("Cannot index " + obj.getClass().getSimpleName() + " with " + key, String.valueOf(key));
    }

    private static boolean isIndex(String s) {
        return !s.isEmpty() && s.chars().allMatch(Character::isDigit);
    }

    private static Field findField(Class<?> c, String name) {
        while (c != null && c != Object.class) {
            try { return c.getDeclaredField(name); } catch (NoSuchFieldException e) { c = c.getSuperclass(); }
        }
        return null;
    }

    private static Method findMethod(Class<?> c, String name) {
        // 1. Nombre exacto (Records: "street()")
        try { return c.getMethod(name); } catch (NoSuchMethodException e) { /* siguiente estilo */ }
        // 2. Estilo Bean: "getStreet()"
        String suffix = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        try { return c.getMethod("get" + suffix); } catch (NoSuchMethodException e) { /* siguiente estilo */ }
        // 3. Estilo Boolean: "isUrgent()"
        try { return c.getMethod("is" + suffix); } catch (NoSuchMethodException e) { return null; }
    }

    // ========================================================================
    // Veracidad, tamaño y secuencias
    // ========================================================================

    public static boolean isTruthy(Object o) {
        if (o == null) return false;
        if (o instanceof Boolean b) return b;
        if (o instanceof Collection<?> c) return !c.isEmpty();
        if (o instanceof Map<?, ?> m) return !m.isEmpty();
        if (o instanceof CharSequence s) return s.length() > 0;
        if (o instanceof Number n) return n.doubleValue() != 0;
        if (o.getClass().isArray()) return Array.getLength(o) > 0;
        return true;
    }

    public static int size(Object o) {
        if (o instanceof Collection<?> c) return c.size();
        if (o instanceof Map<?, ?> m) return m.size();
        if (o instanceof CharSequence s) return s.length();
        if (o != null && o.getClass().isArray()) return Array.getLength(o);
        return 0;
    }

    /**
     * Convierte una fuente de bucle en lista ordenada: colecciones y arrays de
     * cualquier tipo; {@code null} es la lista vacía. Cualquier otra forma devuelve {@code null}.
     */
    public static List<Object> toList(Object value) {
        if (value == null) return new ArrayList<>();
        if (value instanceof Collection<?> c) return new ArrayList<>(c);
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<Object> out = new ArrayList<>(len);
            for (int i = 0; i < len; i++) out.add(Array.get(value, i));
            return out;
        }
        return null;
    }

    // ========================================================================
    // Operadores
    // ========================================================================

    public static boolean equal(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return x.doubleValue() == y.doubleValue();
        }
        if (a instanceof Character || b instanceof Character) {
            return Objects.equals(String.valueOf(a), String.valueOf(b));
        }
        return Objects.equals(a, b);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object a, Object b, String expr) {
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        if (a instanceof CharSequence x && b instanceof CharSequence y) {
            return x.toString().compareTo(y.toString());
        }
        if (a instanceof Comparable ca && b != null && a.getClass() == b.getClass()) {
            return ca.compareTo(b);
        }
        throw new ExpressionException("Cannot compare " + typeName(a) + " with " + typeName(b), expr);
    }

    public static Object arithmetic(char op, Object a, Object b, String expr) {
        if (op == '+' && (a instanceof CharSequence || b instanceof CharSequence)) {
            return stringify(a) + stringify(b);
        }
        if (!(a instanceof Number x) || !(b instanceof Number y)) {
            throw new ExpressionException("Operator '" + op + "' not applicable to " + typeName(a) + " and " + typeName(b), expr);
        }
        if (isIntegral(x) && isIntegral(y)) {
            long l = x.longValue();
            long r = y.longValue();
            return switch (op) {
                case '+' -> l + r;
                case '-' -> l - r;
                case '*' -> l * r;
                case '/' -> {
                    if (r == 0) throw new ExpressionException("Division by zero", expr);
                    yield (l % r == 0) ? (Object) (l / r) : (Object) ((double) l / r);
                }
                case '%' -> {
                    if (r == 0) throw new ExpressionException("Division by zero", expr);
                    yield l % r;
                }
                default -> throw new ExpressionException("Unknown operator '" + op + "'", expr);
            };
        }
        double l = x.doubleValue();
        double r = y.doubleValue();
        return switch (op) {
            case '+' -> l + r;
            case '-' -> l - r;
            case '*' -> l * r;
            case '/' -> {
                if (r == 0) throw new ExpressionException("Division by zero", expr);
                yield l / r;
            }
            case '%' -> {
                if (r == 0) throw new ExpressionException("Division by zero", expr);
                yield l % r;
            }
            default -> throw new ExpressionException("Unknown operator '" + op + "'", expr);
        };
    }

    public static Object negate(Object v, String expr) {
        if (v instanceof BigDecimal d) return d.negate();
        if (v instanceof Number n) {
            return isIntegral(n) ? (Object) (-n.longValue()) : (Object) (-n.doubleValue());
        }
        throw new ExpressionException("Cannot negate " + typeName(v), expr);
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    // ========================================================================
    // Texto
    // ========================================================================

    public static String stringify(Object v) {
        if (v == null) return "";
        if (v instanceof CharSequence s) return s.toString();
        if (v instanceof Double || v instanceof Float) {
            double d = ((Number) v).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return String.valueOf(d);
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (v instanceof Number || v instanceof Boolean || v instanceof Character) return String.valueOf(v);
        if (v instanceof Map<?, ?> || v instanceof Collection<?> || v.getClass().isArray()) {
            try {
                return ObjectMapperFactory.shared().writeValueAsString(v);
            } catch (JsonProcessingException e) {
                throw new ExpressionException("Cannot serialize " + typeName(v), null, e);
            }
        }
        return String.valueOf(v);
    }

    static String typeName(Object v) {
        return v == null ? "null" : v.getClass().getSimpleName();
    }
}
