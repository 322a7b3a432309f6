package pass;

import java.util.function.Supplier;

/**
 * pass type factory, implemented by the enum listing the passes
 */
public interface PassType<T extends Pass> {
    /* constructor */
    Supplier<T> constructor();

    /** a fresh instance, constructor().get() */
    default T create() {
        return constructor().get();
    }

    /** the enum name in lower case, as used in -Dstructuring.passes */
    default String getName() {
        return ((Enum<?>) this).name().toLowerCase();
    }
}
