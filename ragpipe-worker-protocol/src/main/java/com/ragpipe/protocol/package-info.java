/**
 * Wire documents of the worker self-description endpoint ({@code GET /metadata}).
 * Field names are snake_case on the wire; service workers serve them and discovery consumes them.
 */
package com.ragpipe.protocol;
