/**
 * Binary implementation of the message codec.
 *
 * <p>The format is fixed-layout and deterministic: equal messages always
 * produce equal frames, and {@code decode(encode(m))} returns {@code m} for
 * every message whose text is well-formed UTF-16 and whose frame fits the
 * configured limit.</p>
 */
package com.questrail.repomon.codec.impl;
