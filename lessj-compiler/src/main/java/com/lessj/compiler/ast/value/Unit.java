package com.lessj.compiler.ast.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * 数值单位（分子/分母单位列表），不可变
 *
 * <p>backupUnit 记录最初的单位，在单位被约掉但非严格模式下仍需要输出时使用。</p>
 */
public final class Unit {
    public static final Unit EMPTY = new Unit(null, null, null);

    /** 可换算单位组：长度、时间、角度，值为相对组内基准的倍数 */
    public static final Map<String, Map<String, Double>> CONVERSIONS;

    static {
        Map<String, Map<String, Double>> groups = new LinkedHashMap<>();
        Map<String, Double> length = new LinkedHashMap<>();
        length.put("m", 1.0);
        length.put("cm", 0.01);
        length.put("mm", 0.001);
        length.put("in", 0.0254);
        length.put("px", 0.0254 / 96);
        length.put("pt", 0.0254 / 72);
        length.put("pc", 0.0254 / 72 * 12);
        groups.put("length", Collections.unmodifiableMap(length));
        Map<String, Double> duration = new LinkedHashMap<>();
        duration.put("s", 1.0);
        duration.put("ms", 0.001);
        groups.put("duration", Collections.unmodifiableMap(duration));
        Map<String, Double> angle = new LinkedHashMap<>();
        angle.put("rad", 1 / (2 * Math.PI));
        angle.put("deg", 1.0 / 360);
        angle.put("grad", 1.0 / 400);
        angle.put("turn", 1.0);
        groups.put("angle", Collections.unmodifiableMap(angle));
        CONVERSIONS = Collections.unmodifiableMap(groups);
    }

    private static final java.util.regex.Pattern LENGTH_UNITS =
            java.util.regex.Pattern.compile("(?i)px|em|ex|ch|rem|in|cm|mm|pc|pt|vw|vh|vmin|vmax");

    private final List<String> numerator;
    private final List<String> denominator;
    private final String backupUnit;

    public Unit(List<String> numerator, List<String> denominator, String backupUnit) {
        List<String> num = numerator == null ? new ArrayList<String>() : new ArrayList<>(numerator);
        List<String> den = denominator == null ? new ArrayList<String>() : new ArrayList<>(denominator);
        Collections.sort(num);
        Collections.sort(den);
        this.numerator = Collections.unmodifiableList(num);
        this.denominator = Collections.unmodifiableList(den);
        if (backupUnit != null) {
            this.backupUnit = backupUnit;
        } else if (numerator != null && !numerator.isEmpty()) {
            this.backupUnit = numerator.get(0);
        } else {
            this.backupUnit = null;
        }
    }

    public static Unit of(String unit) {
        if (unit == null || unit.isEmpty()) {
            return EMPTY;
        }
        return new Unit(Collections.singletonList(unit), null, null);
    }

    public List<String> getNumerator() {
        return numerator;
    }

    public List<String> getDenominator() {
        return denominator;
    }

    public String getBackupUnit() {
        return backupUnit;
    }

    public Unit withBackupUnit(String backup) {
        return new Unit(numerator, denominator, backup);
    }

    public boolean isEmpty() {
        return numerator.isEmpty() && denominator.isEmpty();
    }

    public boolean isSingular() {
        return numerator.size() <= 1 && denominator.isEmpty();
    }

    public boolean isLength() {
        return LENGTH_UNITS.matcher(toCss(false)).matches();
    }

    /** 大小写不敏感地比较单位字符串 */
    public boolean is(String unitString) {
        return toString().equalsIgnoreCase(unitString);
    }

    /**
     * 单位的 CSS 形式：单一分子单位直接输出，否则在非严格模式下退回 backupUnit
     */
    public String toCss(boolean strictUnits) {
        if (numerator.size() == 1) {
            return numerator.get(0);
        }
        if (!strictUnits && backupUnit != null) {
            return backupUnit;
        }
        if (!strictUnits && !denominator.isEmpty()) {
            return denominator.get(0);
        }
        return "";
    }

    /**
     * 对每个原子单位应用映射（第二个参数表示是否位于分母）
     */
    public Unit map(BiFunction<String, Boolean, String> mapper) {
        List<String> num = new ArrayList<>();
        for (String u : numerator) {
            num.add(mapper.apply(u, Boolean.FALSE));
        }
        List<String> den = new ArrayList<>();
        for (String u : denominator) {
            den.add(mapper.apply(u, Boolean.TRUE));
        }
        return new Unit(num, den, backupUnit);
    }

    /**
     * 返回每个换算组中当前使用的单位（组名 -> 单位）
     */
    public Map<String, String> usedUnits() {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Double>> group : CONVERSIONS.entrySet()) {
            for (String u : numerator) {
                if (group.getValue().containsKey(u) && !result.containsKey(group.getKey())) {
                    result.put(group.getKey(), u);
                }
            }
            for (String u : denominator) {
                if (group.getValue().containsKey(u) && !result.containsKey(group.getKey())) {
                    result.put(group.getKey(), u);
                }
            }
        }
        return result;
    }

    /**
     * 约去分子分母中相同的单位
     */
    public Unit cancel() {
        Map<String, Integer> counter = new LinkedHashMap<>();
        for (String u : numerator) {
            counter.merge(u, 1, Integer::sum);
        }
        for (String u : denominator) {
            counter.merge(u, -1, Integer::sum);
        }
        List<String> num = new ArrayList<>();
        List<String> den = new ArrayList<>();
        for (Map.Entry<String, Integer> e : counter.entrySet()) {
            int count = e.getValue();
            for (int i = 0; i < count; i++) {
                num.add(e.getKey());
            }
            for (int i = 0; i < -count; i++) {
                den.add(e.getKey());
            }
        }
        return new Unit(num, den, backupUnit);
    }

    /** 乘法：分子、分母分别合并后约分 */
    public Unit multiply(Unit other) {
        List<String> num = new ArrayList<>(numerator);
        num.addAll(other.numerator);
        List<String> den = new ArrayList<>(denominator);
        den.addAll(other.denominator);
        return new Unit(num, den, backupUnit).cancel();
    }

    /** 除法：交叉合并后约分 */
    public Unit divide(Unit other) {
        List<String> num = new ArrayList<>(numerator);
        num.addAll(other.denominator);
        List<String> den = new ArrayList<>(denominator);
        den.addAll(other.numerator);
        return new Unit(num, den, backupUnit).cancel();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(String.join("*", numerator));
        for (String d : denominator) {
            sb.append('/').append(d);
        }
        return sb.toString();
    }
}
