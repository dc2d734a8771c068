package com.shopflow.order.saga;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Saga 실행 하나의 보상 기록. 마지막에 기록된 것이 먼저 실행된다 (LIFO).
 */
public class CompensationLog {

    private final Deque<CompensationStep> steps = new ArrayDeque<>();

    public void push(CompensationStep step) {
        steps.push(step);
    }

    /** 역순으로 모두 꺼낸다. 꺼낸 뒤 기록은 비어 있다 */
    public List<CompensationStep> drain() {
        List<CompensationStep> reversed = new ArrayList<>(steps.size());
        while (!steps.isEmpty()) {
            reversed.add(steps.pop());
        }
        return reversed;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int size() {
        return steps.size();
    }
}
