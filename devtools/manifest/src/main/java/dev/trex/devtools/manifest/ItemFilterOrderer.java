package dev.trex.devtools.manifest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Final pass over collected test items: keeps the ones listed by the manifest and puts them in manifest order.
 */
public class ItemFilterOrderer {

    private final ManifestSession session;

    public ItemFilterOrderer(ManifestSession session) {
        this.session = session;
    }

    /**
     * @param items collected items, in collection order
     * @param idOf  composite id ({@code file::test}) of an item
     * @return {@code items} itself when the override is inactive, otherwise a new filtered and sorted list
     */
    public <T> List<T> apply(List<T> items, Function<? super T, String> idOf) {
        Optional<OrderMap> orderMap = session.getOrderMap();
        if (orderMap.isEmpty()) {
            return items;
        }
        return apply(orderMap.get(), items, idOf);
    }

    public static <T> List<T> apply(OrderMap orderMap, List<T> items, Function<? super T, String> idOf) {
        List<T> listed = items.stream()
                .filter(item -> orderMap.contains(idOf.apply(item)))
                .collect(Collectors.toCollection(ArrayList::new));
        // List.sort is stable, unlisted items keep their relative order at the end
        listed.sort(Comparator.comparingInt(item -> orderMap.rank(idOf.apply(item))));
        return listed;
    }
}
