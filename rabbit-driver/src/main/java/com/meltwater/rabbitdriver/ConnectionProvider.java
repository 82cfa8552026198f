package com.meltwater.rabbitdriver;

import java.io.IOException;

/**
 * Supplies the broker connection a driver works on.
 *
 * The provider owns the connection, the driver never closes it.
 */
public interface ConnectionProvider {

    /**
     * @return an open connection
     * @throws IOException if no connection could be established, the driver does not retry
     */
    AmqpConnection getConnection() throws IOException;
}
