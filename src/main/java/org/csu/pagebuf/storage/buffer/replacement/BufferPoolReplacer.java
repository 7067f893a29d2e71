package org.csu.pagebuf.storage.buffer.replacement;

import org.csu.pagebuf.storage.buffer.FrameDescriptor;

/**
 * 缓存替换策略接口。
 */
public interface BufferPoolReplacer {
    /**
     * 在描述符表中挑出一个可以装入新页的帧。
     * 返回的帧要么本来就无效，要么有效但未被 pin 且未被引用；
     * 淘汰（写回、删索引、清描述符）由调用方完成。
     * @param frames 描述符表，下标即帧号
     * @return 帧号
     * @throws org.csu.pagebuf.common.exception.BufferExceededException 没有可替换的帧
     */
    int pickVictim(FrameDescriptor[] frames);
}
