package org.csu.pagebuf.common.exception;

/**
 * 从槽位索引中删除一个不存在的 (file, page) 映射。
 */
public class SlotNotFoundException extends BufferPoolException {
    public SlotNotFoundException(String fileName, int pageNum) {
        super(String.format("No slot mapped for page %d of file '%s'", pageNum, fileName));
    }
}
