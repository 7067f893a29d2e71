package org.csu.pagebuf.storage.buffer.index;

import org.csu.pagebuf.common.exception.DuplicateSlotException;
import org.csu.pagebuf.common.exception.SlotNotFoundException;
import org.csu.pagebuf.storage.disk.PagedFile;
import org.csu.pagebuf.storage.page.PageId;

import java.util.OptionalInt;

/**
 * 拉链法实现的槽位索引，桶数在构造时固定，不做扩容。
 * 文件按引用相等比较，与缓冲池区分文件的方式一致。
 */
public class BufferHashTable implements SlotIndex {

    private static final class Bucket {
        final PagedFile file;
        final int pageNum;
        final int frameNo;
        Bucket next;

        Bucket(PagedFile file, int pageNum, int frameNo, Bucket next) {
            this.file = file;
            this.pageNum = pageNum;
            this.frameNo = frameNo;
            this.next = next;
        }
    }

    private final Bucket[] table;
    private int size = 0;

    public BufferHashTable(int htSize) {
        if (htSize <= 0) {
            throw new IllegalArgumentException("Hash table size must be positive: " + htSize);
        }
        this.table = new Bucket[htSize];
    }

    /**
     * 为 numBufs 个帧计算桶数：留出 scale 倍的余量并保证是奇数，减少聚集。
     */
    public static int sizeFor(int numBufs, double scale) {
        int size = (int) (numBufs * scale) + 1;
        return size % 2 == 0 ? size + 1 : size;
    }

    private int hash(PagedFile file, int pageNum) {
        int h = 31 * System.identityHashCode(file) + pageNum;
        return Math.floorMod(h, table.length);
    }

    @Override
    public OptionalInt lookup(PagedFile file, PageId pageId) {
        int pageNum = pageId.getPageNum();
        for (Bucket b = table[hash(file, pageNum)]; b != null; b = b.next) {
            if (b.file == file && b.pageNum == pageNum) {
                return OptionalInt.of(b.frameNo);
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public void insert(PagedFile file, PageId pageId, int frameNo) {
        int pageNum = pageId.getPageNum();
        int index = hash(file, pageNum);
        for (Bucket b = table[index]; b != null; b = b.next) {
            if (b.file == file && b.pageNum == pageNum) {
                throw new DuplicateSlotException(file.getFileName(), pageNum, b.frameNo);
            }
        }
        table[index] = new Bucket(file, pageNum, frameNo, table[index]);
        size++;
    }

    @Override
    public void remove(PagedFile file, PageId pageId) {
        int pageNum = pageId.getPageNum();
        int index = hash(file, pageNum);
        Bucket prev = null;
        for (Bucket b = table[index]; b != null; prev = b, b = b.next) {
            if (b.file == file && b.pageNum == pageNum) {
                if (prev == null) {
                    table[index] = b.next;
                } else {
                    prev.next = b.next;
                }
                size--;
                return;
            }
        }
        throw new SlotNotFoundException(file.getFileName(), pageNum);
    }

    @Override
    public int size() {
        return size;
    }

    public int getBucketCount() {
        return table.length;
    }
}
