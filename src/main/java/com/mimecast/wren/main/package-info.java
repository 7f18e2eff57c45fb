/**
 * Server runtime and command line entry points.
 */
package com.mimecast.wren.main;
