/**
 * Command-line front end: option parsing with picocli, OpenCV detector
 * adapters and the JSON run summary.
 */
package com.keypointcensus.cli;
