package li.cil.primint.registry;

import it.unimi.dsi.fastutil.ints.Int2ObjectArrayMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import li.cil.primint.api.PrimitiveWordType;
import li.cil.primint.word.WordTypes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup of word types by name or by bit width and signedness.
 * <p>
 * The standard types from {@link WordTypes} are registered on class initialization. The
 * pointer-width aliases are only reachable by name, width based lookups resolve to the
 * explicitly sized types.
 */
public final class WordTypeRegistry {
    private static final Logger LOGGER = LogManager.getLogger();

    private static final Map<String, PrimitiveWordType<?>> TYPES_BY_NAME = new LinkedHashMap<>();
    private static final Int2ObjectMap<PrimitiveWordType<?>> SIGNED_BY_WIDTH = new Int2ObjectArrayMap<>();
    private static final Int2ObjectMap<PrimitiveWordType<?>> UNSIGNED_BY_WIDTH = new Int2ObjectArrayMap<>();

    static {
        for (final PrimitiveWordType<?> type : WordTypes.ALL) {
            addType(type);
        }
    }

    public static synchronized void addType(final PrimitiveWordType<?> type) {
        final PrimitiveWordType<?> previous = TYPES_BY_NAME.put(type.getName(), type);
        if (previous != null && previous != type) {
            LOGGER.warn("Replacing word type [{}] with [{}].", previous, type);
        } else {
            LOGGER.debug("Registered word type [{}] ({} bit, {}).", type.getName(), type.getBits(), type.isSigned() ? "signed" : "unsigned");
        }

        if (previous != null) {
            updateWidthLookup(previous.getBits(), previous.isSigned());
        }
        updateWidthLookup(type.getBits(), type.isSigned());
    }

    @Nullable
    public static synchronized PrimitiveWordType<?> getType(final String name) {
        final PrimitiveWordType<?> type = TYPES_BY_NAME.get(name);
        if (type == null) {
            LOGGER.warn("No word type named [{}].", name);
        }
        return type;
    }

    @Nullable
    public static synchronized PrimitiveWordType<?> getType(final int bits, final boolean signed) {
        final PrimitiveWordType<?> type = (signed ? SIGNED_BY_WIDTH : UNSIGNED_BY_WIDTH).get(bits);
        if (type == null) {
            LOGGER.warn("No {} word type with [{}] bits.", signed ? "signed" : "unsigned", bits);
        }
        return type;
    }

    /**
     * Looks up a type by width and signedness and checks that its values are held in the
     * given Java type.
     *
     * @param valueClass the Java type values of the word type are expected to be held in.
     * @param bits       the bit width of the type.
     * @param signed     whether the type is signed.
     * @param <W>        the Java type values of the word type are held in.
     * @return the word type, or {@code null} if there is no such type.
     * @throws IllegalArgumentException if the registered type holds values of a different Java type.
     */
    @Nullable
    @SuppressWarnings("unchecked")
    public static <W> PrimitiveWordType<W> getType(final Class<W> valueClass, final int bits, final boolean signed) {
        final PrimitiveWordType<?> type = getType(bits, signed);
        if (type == null) {
            return null;
        }

        if (!valueClass.isInstance(type.zero())) {
            throw new IllegalArgumentException("Word type [" + type.getName() + "] does not hold values of type [" + valueClass.getName() + "].");
        }

        return (PrimitiveWordType<W>) type;
    }

    public static synchronized List<PrimitiveWordType<?>> getTypes() {
        return new ArrayList<>(TYPES_BY_NAME.values());
    }

    // First type registered for a width wins, so aliases such as isize do not shadow i64.
    private static void updateWidthLookup(final int bits, final boolean signed) {
        final Int2ObjectMap<PrimitiveWordType<?>> byWidth = signed ? SIGNED_BY_WIDTH : UNSIGNED_BY_WIDTH;
        for (final PrimitiveWordType<?> type : TYPES_BY_NAME.values()) {
            if (type.getBits() == bits && type.isSigned() == signed) {
                byWidth.put(bits, type);
                return;
            }
        }
        byWidth.remove(bits);
    }

    private WordTypeRegistry() {
    }
}
