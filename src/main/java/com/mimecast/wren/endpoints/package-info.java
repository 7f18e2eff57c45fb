/**
 * JSON API endpoints.
 */
package com.mimecast.wren.endpoints;
