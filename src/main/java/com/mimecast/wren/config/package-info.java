/**
 * Configuration.
 */
package com.mimecast.wren.config;
