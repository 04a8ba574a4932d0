package com.textindex.postings;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * 有序去重的倒排计数存储，以并行的基本类型数组保存 (次级键, 权重)。
 *
 * 键按无符号顺序排列。批量追加时允许暂时无序，任何读取前都会先恢复有序。
 */
final class CountStore {
    private static final int MIN_CAPACITY = 4;
    private static final long[] EMPTY_KEYS = new long[0];
    private static final double[] EMPTY_WEIGHTS = new double[0];

    private long[] keys = EMPTY_KEYS;
    private double[] weights = EMPTY_WEIGHTS;
    private int size;
    private boolean sorted = true;

    int size() {
        return size;
    }

    boolean isEmpty() {
        return size == 0;
    }

    int capacity() {
        return keys.length;
    }

    /**
     * 累加权重，键不存在时按有序位置插入。
     */
    void increaseCount(long key, double amount) {
        ensureSorted();
        int index = indexOf(key, size);
        if (index >= 0) {
            weights[index] += amount;
            return;
        }
        insertAt(-index - 1, key, amount);
    }

    /**
     * 精确查找权重。
     *
     * @throws SecondaryKeyNotFoundException 键不存在时抛出
     */
    double count(long key) {
        ensureSorted();
        int index = indexOf(key, size);
        if (index < 0) {
            throw new SecondaryKeyNotFoundException(key);
        }
        return weights[index];
    }

    boolean contains(long key) {
        ensureSorted();
        return indexOf(key, size) >= 0;
    }

    long secondaryKey(int index) {
        ensureSorted();
        checkIndex(index);
        return keys[index];
    }

    double weight(int index) {
        ensureSorted();
        checkIndex(index);
        return weights[index];
    }

    /**
     * 在 [0, limit) 区间内二分查找键。调用前必须保证该区间有序。
     *
     * @return 命中下标；未命中时返回 -(插入点) - 1
     */
    int indexOf(long key, int limit) {
        int low = 0;
        int high = limit - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            int cmp = Long.compareUnsigned(keys[mid], key);
            if (cmp < 0) {
                low = mid + 1;
            } else if (cmp > 0) {
                high = mid - 1;
            } else {
                return mid;
            }
        }
        return -(low + 1);
    }

    void addWeightAt(int index, double amount) {
        checkIndex(index);
        weights[index] += amount;
    }

    /**
     * 批量替换内容，输入顺序任意，但键必须唯一。
     *
     * @throws IllegalArgumentException 输入包含重复键时抛出
     */
    void replaceContents(List<PostingEntry> entries) {
        long[] newKeys = new long[entries.size()];
        double[] newWeights = new double[entries.size()];
        int index = 0;
        for (PostingEntry entry : entries) {
            if (entry == null) {
                throw new IllegalArgumentException("倒排项不能为null，位置=" + index);
            }
            newKeys[index] = entry.secondaryKey();
            newWeights[index] = entry.weight();
            index++;
        }
        keys = newKeys;
        weights = newWeights;
        size = newKeys.length;
        sorted = false;
        sortByKey();
        int duplicate = findDuplicate();
        if (duplicate >= 0) {
            long key = keys[duplicate];
            clear();
            throw new IllegalArgumentException("次级键重复: " + Long.toUnsignedString(key));
        }
        sorted = true;
    }

    /**
     * 从游标追加全部倒排项，不立即排序，结束后收缩存储。
     */
    void replaceContents(Iterator<PostingEntry> entries) {
        clear();
        while (entries.hasNext()) {
            PostingEntry entry = entries.next();
            if (entry == null) {
                throw new IllegalArgumentException("倒排项不能为null，位置=" + size);
            }
            appendUnsorted(entry.secondaryKey(), entry.weight());
        }
        shrinkToFit();
    }

    /**
     * 直接追加到尾部，不检查重复也不保持有序。
     */
    void appendUnsorted(long key, double weight) {
        ensureCapacity(size + 1);
        if (size > 0 && Long.compareUnsigned(keys[size - 1], key) >= 0) {
            sorted = false;
        }
        keys[size] = key;
        weights[size] = weight;
        size++;
    }

    /**
     * 恢复有序状态。
     *
     * @throws IllegalStateException 延迟追加的数据中存在重复键时抛出
     */
    void ensureSorted() {
        if (sorted) {
            return;
        }
        sortByKey();
        int duplicate = findDuplicate();
        if (duplicate >= 0) {
            throw new IllegalStateException("批量追加的数据包含重复次级键: " + Long.toUnsignedString(keys[duplicate]));
        }
        sorted = true;
    }

    void shrinkToFit() {
        if (keys.length == size) {
            return;
        }
        keys = size == 0 ? EMPTY_KEYS : Arrays.copyOf(keys, size);
        weights = size == 0 ? EMPTY_WEIGHTS : Arrays.copyOf(weights, size);
    }

    void clear() {
        keys = EMPTY_KEYS;
        weights = EMPTY_WEIGHTS;
        size = 0;
        sorted = true;
    }

    double totalWeight() {
        double total = 0.0;
        for (int index = 0; index < size; index++) {
            total += weights[index];
        }
        return total;
    }

    List<PostingEntry> entries() {
        ensureSorted();
        List<PostingEntry> result = new ArrayList<>(size);
        for (int index = 0; index < size; index++) {
            result.add(new PostingEntry(keys[index], weights[index]));
        }
        return Collections.unmodifiableList(result);
    }

    private void insertAt(int position, long key, double weight) {
        ensureCapacity(size + 1);
        System.arraycopy(keys, position, keys, position + 1, size - position);
        System.arraycopy(weights, position, weights, position + 1, size - position);
        keys[position] = key;
        weights[position] = weight;
        size++;
    }

    private void ensureCapacity(int required) {
        if (required <= keys.length) {
            return;
        }
        int newCapacity = Math.max(MIN_CAPACITY, keys.length + (keys.length >> 1));
        if (newCapacity < required) {
            newCapacity = required;
        }
        keys = Arrays.copyOf(keys, newCapacity);
        weights = Arrays.copyOf(weights, newCapacity);
    }

    /**
     * 按键原地堆排序 [0, size)，权重随键一起移动。
     */
    private void sortByKey() {
        for (int parent = (size >>> 1) - 1; parent >= 0; parent--) {
            siftDown(parent, size);
        }
        for (int last = size - 1; last > 0; last--) {
            swap(0, last);
            siftDown(0, last);
        }
    }

    private void siftDown(int parent, int limit) {
        while (true) {
            int child = (parent << 1) + 1;
            if (child >= limit) {
                return;
            }
            if (child + 1 < limit && Long.compareUnsigned(keys[child + 1], keys[child]) > 0) {
                child++;
            }
            if (Long.compareUnsigned(keys[parent], keys[child]) >= 0) {
                return;
            }
            swap(parent, child);
            parent = child;
        }
    }

    private void swap(int left, int right) {
        long key = keys[left];
        keys[left] = keys[right];
        keys[right] = key;
        double weight = weights[left];
        weights[left] = weights[right];
        weights[right] = weight;
    }

    private int findDuplicate() {
        for (int index = 1; index < size; index++) {
            if (keys[index] == keys[index - 1]) {
                return index;
            }
        }
        return -1;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("倒排项下标越界: " + index + ", size=" + size);
        }
    }
}
