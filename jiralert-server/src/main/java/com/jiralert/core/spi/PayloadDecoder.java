package com.jiralert.core.spi;

import com.jiralert.exception.DecodeException;
import com.jiralert.model.AlertBatch;

/**
 * 请求体解码器, 要么完整解码要么失败
 */
public interface PayloadDecoder {

    AlertBatch decode(byte[] body) throws DecodeException;
}
