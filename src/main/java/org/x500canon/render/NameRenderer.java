package org.x500canon.render;

import org.x500canon.name.OrderedName;

/**
 * Formats an {@link OrderedName}.
 * <p>
 * Renderers only assemble output. Ordering and normalization are already
 * done by the time a name reaches them.
 *
 * @param <T> type of the rendered form
 */
public interface NameRenderer<T> {
    T render(OrderedName name);
}
