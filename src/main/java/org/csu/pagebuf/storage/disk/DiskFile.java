package org.csu.pagebuf.storage.disk;

import org.csu.pagebuf.common.exception.InvalidPageException;
import org.csu.pagebuf.storage.page.Page;
import org.csu.pagebuf.storage.page.PageId;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.HashSet;
import java.util.Set;

import static org.csu.pagebuf.storage.page.Page.PAGE_SIZE;

/**
 * 基于 RandomAccessFile 的分页文件。
 * 文件开头预留 4KB 作为文件头，目前只存空闲链表的头指针；
 * 被删除的页通过各自的前 4 个字节串成链表，分配时后删先用。
 */
public class DiskFile implements PagedFile {
    private static final int FILE_HEADER_SIZE = 4096;
    private static final long FREE_LIST_HEADER_POINTER_OFFSET = 0;

    private final String filePath;
    private RandomAccessFile file;

    private int freeListHeadPageId = PageId.INVALID_PAGE_NUM;
    private int nextFreePageId = 0;
    // 空闲链表在内存中的镜像，用来快速判断某页是否已被删除
    private final Set<Integer> freePages = new HashSet<>();

    public DiskFile(String filePath) {
        this.filePath = filePath;
    }

    public void open() throws IOException {
        File f = new File(filePath);

        File parentDir = f.getParentFile();
        if (parentDir != null && !parentDir.exists()) {
            parentDir.mkdirs();
        }

        boolean isNewFile = !f.exists() || f.length() == 0;
        this.file = new RandomAccessFile(f, "rw");
        freePages.clear();

        if (isNewFile) {
            file.setLength(0);
            file.write(new byte[FILE_HEADER_SIZE]);
            freeListHeadPageId = PageId.INVALID_PAGE_NUM;
            file.seek(FREE_LIST_HEADER_POINTER_OFFSET);
            file.writeInt(freeListHeadPageId);
            nextFreePageId = 0;
        } else {
            file.seek(FREE_LIST_HEADER_POINTER_OFFSET);
            freeListHeadPageId = file.readInt();
            nextFreePageId = (int) ((file.length() - FILE_HEADER_SIZE) / PAGE_SIZE);
            // 沿链表重建空闲页集合
            int cursor = freeListHeadPageId;
            while (cursor != PageId.INVALID_PAGE_NUM) {
                if (cursor < 0 || cursor >= nextFreePageId || !freePages.add(cursor)) {
                    throw new IOException("Corrupted free list in '" + filePath + "' at page " + cursor);
                }
                file.seek(offsetOf(cursor));
                cursor = file.readInt();
            }
        }
    }

    public void close() throws IOException {
        if (file != null) {
            file.seek(FREE_LIST_HEADER_POINTER_OFFSET);
            file.writeInt(freeListHeadPageId);
            file.getFD().sync();
            file.close();
            file = null;
        }
    }

    public boolean isOpen() {
        return file != null;
    }

    @Override
    public synchronized Page readPage(PageId pageId) throws IOException {
        ensureOpen();
        checkExists(pageId.getPageNum());
        byte[] pageData = new byte[PAGE_SIZE];
        file.seek(offsetOf(pageId.getPageNum()));
        file.readFully(pageData);
        return new Page(pageId, pageData);
    }

    @Override
    public synchronized void writePage(Page page) throws IOException {
        ensureOpen();
        checkExists(page.getPageNum());
        writeRaw(page.getPageNum(), page.getData().array());
    }

    @Override
    public synchronized Page allocatePage() throws IOException {
        ensureOpen();
        PageId pageId;
        if (freeListHeadPageId != PageId.INVALID_PAGE_NUM) {
            int reused = freeListHeadPageId;
            file.seek(offsetOf(reused));
            freeListHeadPageId = file.readInt();
            freePages.remove(reused);
            pageId = new PageId(reused);
        } else {
            pageId = new PageId(nextFreePageId++);
        }
        Page page = new Page(pageId);
        writeRaw(pageId.getPageNum(), page.getData().array());
        return page;
    }

    @Override
    public synchronized void deletePage(PageId pageId) throws IOException {
        ensureOpen();
        int pageNum = pageId.getPageNum();
        checkExists(pageNum);
        byte[] tombstone = new byte[PAGE_SIZE];
        Page marker = new Page(pageId, tombstone);
        marker.getData().putInt(0, freeListHeadPageId);
        writeRaw(pageNum, tombstone);
        freeListHeadPageId = pageNum;
        freePages.add(pageNum);
    }

    @Override
    public String getFileName() {
        return filePath;
    }

    /**
     * 当前存在（已分配且未删除）的页数。
     */
    public int getPageCount() {
        return nextFreePageId - freePages.size();
    }

    public boolean exists(PageId pageId) {
        int pageNum = pageId.getPageNum();
        return pageNum >= 0 && pageNum < nextFreePageId && !freePages.contains(pageNum);
    }

    private void checkExists(int pageNum) {
        if (!exists(new PageId(pageNum))) {
            throw new InvalidPageException(filePath, pageNum);
        }
    }

    private void writeRaw(int pageNum, byte[] bytes) throws IOException {
        file.seek(offsetOf(pageNum));
        file.write(bytes);
        file.getFD().sync();
    }

    private long offsetOf(int pageNum) {
        return (long) pageNum * PAGE_SIZE + FILE_HEADER_SIZE;
    }

    private void ensureOpen() throws IOException {
        if (file == null) {
            throw new IOException("File '" + filePath + "' is not open");
        }
    }

    @Override
    public String toString() {
        return filePath;
    }
}
