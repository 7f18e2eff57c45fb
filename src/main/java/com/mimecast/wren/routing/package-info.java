/**
 * Request routing and the public directory sandbox.
 */
package com.mimecast.wren.routing;
