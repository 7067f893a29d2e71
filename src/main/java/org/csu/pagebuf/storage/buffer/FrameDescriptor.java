package org.csu.pagebuf.storage.buffer;

import lombok.Getter;
import org.csu.pagebuf.storage.disk.PagedFile;
import org.csu.pagebuf.storage.page.PageId;

/**
 * 描述符表中的一项，与缓冲池中同下标的帧一一对应。
 * valid 为 false 时其余字段都没有意义，{@link #clear()} 会把它们复位。
 */
@Getter
public class FrameDescriptor {
    private final int frameNo;
    private PagedFile file;
    private PageId pageId;
    private int pinCount;
    private boolean dirty;
    private boolean valid;
    private boolean referenced;

    FrameDescriptor(int frameNo) {
        this.frameNo = frameNo;
        clear();
    }

    private FrameDescriptor(FrameDescriptor other) {
        this.frameNo = other.frameNo;
        this.file = other.file;
        this.pageId = other.pageId;
        this.pinCount = other.pinCount;
        this.dirty = other.dirty;
        this.valid = other.valid;
        this.referenced = other.referenced;
    }

    /**
     * 帧装入新页后调用：有效、干净、未被引用、pin 计数为 1。
     */
    void set(PagedFile file, PageId pageId) {
        this.file = file;
        this.pageId = pageId;
        this.pinCount = 1;
        this.dirty = false;
        this.valid = true;
        this.referenced = false;
    }

    void clear() {
        this.file = null;
        this.pageId = null;
        this.pinCount = 0;
        this.dirty = false;
        this.valid = false;
        this.referenced = false;
    }

    void pin() {
        pinCount++;
        referenced = true;
    }

    void unpin() {
        if (pinCount == 0) {
            throw new IllegalStateException("pin count of frame " + frameNo + " would go negative");
        }
        pinCount--;
    }

    void markDirty() {
        dirty = true;
    }

    void markClean() {
        dirty = false;
    }

    public void clearReferenced() {
        referenced = false;
    }

    boolean belongsTo(PagedFile other) {
        return file != null && file == other;
    }

    /**
     * 只读快照，给测试和诊断输出用。
     */
    FrameDescriptor snapshot() {
        return new FrameDescriptor(this);
    }

    @Override
    public String toString() {
        return String.format("file:%s pageNo:%s valid:%b pinCnt:%d dirty:%b refbit:%b",
                file == null ? "NULL" : file.getFileName(),
                pageId == null ? "NULL" : pageId.toString(),
                valid, pinCount, dirty, referenced);
    }
}
