/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.pancake.errors;

/**
 * Page bytes could not be decoded: truncated or malformed data, an unknown value tag,
 * or a codec that is not available. Never retried, decoding the same bytes again
 * cannot succeed.
 */
public class PageDecodeException extends PancakeException {

    public PageDecodeException(String message) {
        super(message);
    }

    public PageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
