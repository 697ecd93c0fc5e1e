/**
 * Redis connection for the shared provider response cache, using Jedis directly
 *
 * @author William Callahan
 *
 * Features:
 * - Accepts either a REDIS_SERVER URL (redis:// or rediss://) or host/port properties
 * - Pings on startup so a bad configuration fails fast
 * - Small connection pool sized for cache reads and writes
 */

package com.williamcallahan.film_rating_aggregator.config;

import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import redis.clients.jedis.Connection;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisPooled;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

@Configuration
@Profile("!test")
@Conditional(RedisEnvironmentCondition.class)
public class RedisConfig {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(RedisConfig.class);

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Value("${spring.data.redis.password:#{null}}")
    private String redisPassword;

    @Value("${REDIS_SERVER:#{null}}")
    private String redisUrl;

    @Value("${spring.data.redis.timeout:5000}")
    private int timeout;

    @Value("${spring.data.redis.jedis.pool.max-active:8}")
    private int maxActive;

    /**
     * Creates JedisPooled instance used by the response cache
     *
     * @return Configured JedisPooled instance
     */
    @Bean(destroyMethod = "close")
    public JedisPooled jedisPooled() {
        HostAndPort hostAndPort = createHostAndPort();
        DefaultJedisClientConfig.Builder clientConfig = DefaultJedisClientConfig.builder()
            .connectionTimeoutMillis(timeout)
            .socketTimeoutMillis(timeout)
            .ssl(redisUrl != null && redisUrl.startsWith("rediss://"));
        String password = extractPassword();
        if (password != null && !password.isEmpty()) {
            clientConfig.password(password);
        }

        GenericObjectPoolConfig<Connection> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(maxActive);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setMaxWait(Duration.ofMillis(timeout));

        logger.info("Creating JedisPooled bean: host={}, port={}, maxTotal={}",
            hostAndPort.getHost(), hostAndPort.getPort(), maxActive);

        JedisPooled jedis = new JedisPooled(hostAndPort, clientConfig.build(), poolConfig);
        try {
            String pong = jedis.ping();
            logger.info("Redis ping successful on startup: {}", pong);
        } catch (Exception e) {
            jedis.close();
            throw new IllegalStateException("Failed to ping Redis during startup: " + e.getMessage(), e);
        }
        return jedis;
    }

    private HostAndPort createHostAndPort() {
        if (redisUrl != null && !redisUrl.isEmpty()) {
            try {
                URI uri = new URI(redisUrl);
                return new HostAndPort(uri.getHost(), uri.getPort() != -1 ? uri.getPort() : 6379);
            } catch (URISyntaxException e) {
                throw new IllegalStateException("Invalid Redis URL: " + maskCredentials(redisUrl), e);
            }
        }
        return new HostAndPort(redisHost, redisPort);
    }

    private String extractPassword() {
        if (redisUrl != null && !redisUrl.isEmpty()) {
            try {
                URI uri = new URI(redisUrl);
                if (uri.getUserInfo() != null) {
                    String[] userInfo = uri.getUserInfo().split(":", 2);
                    if (userInfo.length > 1) {
                        return userInfo[1];
                    }
                }
            } catch (URISyntaxException e) {
                logger.warn("Failed to parse Redis URL for password extraction: {}", e.getMessage());
            }
        }
        return redisPassword;
    }

    private String maskCredentials(String url) {
        int at = url.indexOf('@');
        int scheme = url.indexOf("://");
        if (at > 0 && scheme > 0 && at > scheme) {
            return url.substring(0, scheme + 3) + "******" + url.substring(at);
        }
        return url;
    }
}
