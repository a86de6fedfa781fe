package com.ragpipe.activity;

import java.util.List;

/**
 * An activity body. Receives the positional arguments produced by the step's input transform and returns
 * a JSON-compatible value (maps, lists, strings, numbers, booleans or null).
 */
@FunctionalInterface
public interface ActivityFunction {

    Object invoke(List<Object> args) throws Exception;
}
