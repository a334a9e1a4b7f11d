/**
 * Message content model: fence-aware segmentation of message text and the diff that
 * picks the cheapest re-render between two parses.
 */
package io.chatstream.core.content;
