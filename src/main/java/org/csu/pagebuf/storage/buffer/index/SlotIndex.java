package org.csu.pagebuf.storage.buffer.index;

import org.csu.pagebuf.storage.disk.PagedFile;
import org.csu.pagebuf.storage.page.PageId;

import java.util.OptionalInt;

/**
 * (file, page) 到帧号的反向索引。
 */
public interface SlotIndex {

    /**
     * 查找映射。未命中是正常情况，返回空而不是抛异常。
     */
    OptionalInt lookup(PagedFile file, PageId pageId);

    /**
     * @throws org.csu.pagebuf.common.exception.DuplicateSlotException 映射已存在
     */
    void insert(PagedFile file, PageId pageId, int frameNo);

    /**
     * @throws org.csu.pagebuf.common.exception.SlotNotFoundException 映射不存在
     */
    void remove(PagedFile file, PageId pageId);

    int size();
}
