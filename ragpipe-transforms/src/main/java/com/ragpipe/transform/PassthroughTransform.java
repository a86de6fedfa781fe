package com.ragpipe.transform;

import java.util.ArrayList;
import java.util.List;

/** Uses the data as the argument list; a non-list value becomes the single argument. */
public final class PassthroughTransform implements Transform {

    public static final String NAME = "passthrough";

    @Override
    public List<Object> apply(Object data, TransformContext context) {
        if (data instanceof List) {
            return new ArrayList<>((List<?>) data);
        }
        List<Object> single = new ArrayList<>(1);
        single.add(data);
        return single;
    }
}
