/**
 * Server log with an in-memory ring buffer of recent lines.
 */
package com.mimecast.wren.logging;
