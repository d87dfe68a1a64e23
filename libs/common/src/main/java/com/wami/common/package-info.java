/**
 * Error model shared by every WAMI module.
 *
 * <p>All failures extend {@link com.wami.common.WamiException} and expose an {@link
 * com.wami.common.ErrorKind}. Nothing in the core swallows an error: parsing, building and
 * authorization either return a valid value or throw.
 */
package com.wami.common;
