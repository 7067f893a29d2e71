package org.csu.pagebuf.common.exception;

/**
 * 向槽位索引插入一个已经存在的 (file, page) 映射。
 */
public class DuplicateSlotException extends BufferPoolException {
    public DuplicateSlotException(String fileName, int pageNum, int existingFrame) {
        super(String.format("Page %d of file '%s' is already mapped to frame %d", pageNum, fileName, existingFrame));
    }
}
