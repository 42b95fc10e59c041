package com.healthmetrics.core.queue;

import java.util.List;

@FunctionalInterface
public interface BatchWriter<T> {

    void write(List<T> batch);
}
