package org.csu.pagebuf.common.exception;

import lombok.Getter;

/**
 * 帧声称属于某个文件却没有标记为有效，说明描述符表已经不一致。
 */
@Getter
public class InvalidFrameException extends BufferPoolException {
    private final int frameNo;

    public InvalidFrameException(int frameNo, boolean dirty, boolean valid, boolean referenced) {
        super(String.format("Invalid frame %d: dirty=%b valid=%b refbit=%b", frameNo, dirty, valid, referenced));
        this.frameNo = frameNo;
    }
}
