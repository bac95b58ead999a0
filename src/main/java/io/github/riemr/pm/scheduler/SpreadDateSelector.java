package io.github.riemr.pm.scheduler;

import java.util.ArrayList;
import java.util.List;

/**
 * 候補日リスト全体に均等に散らして n 件を選ぶ。
 * インデックスは round(i * (len - 1) / (n - 1))（四捨五入）、n == 1 のときは先頭のみ。
 */
public class SpreadDateSelector {

    public <T> List<T> select(List<T> candidates, int count) {
        int n = Math.min(count, candidates.size());
        if (n <= 0) {
            return List.of();
        }
        List<T> selected = new ArrayList<>(n);
        for (int idx : spreadIndices(candidates.size(), n)) {
            selected.add(candidates.get(idx));
        }
        return List.copyOf(selected);
    }

    /**
     * 0..size-1 から n 個の狭義単調増加なインデックスを返す（n <= size 前提）。
     * 浮動小数を避け、四捨五入は整数演算 floor((2*i*(size-1) + (n-1)) / (2*(n-1))) で行う。
     */
    static int[] spreadIndices(int size, int n) {
        if (n <= 0 || size <= 0) {
            return new int[0];
        }
        if (n > size) {
            throw new IllegalArgumentException("Cannot pick " + n + " of " + size + " candidates");
        }
        int[] indices = new int[n];
        if (n == 1) {
            return indices;
        }
        long span = size - 1L;
        long steps = n - 1L;
        for (int i = 0; i < n; i++) {
            indices[i] = (int) ((2L * i * span + steps) / (2L * steps));
        }
        return indices;
    }
}
