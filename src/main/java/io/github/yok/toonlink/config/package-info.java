/**
 * Configuration models bound from {@code application.yml}.
 */
package io.github.yok.toonlink.config;
