//
// ========================================================================
// Copyright (c) 1995-2022 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.mortbay.workpool.examples;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mortbay.workpool.thread.ShutdownMode;
import org.mortbay.workpool.thread.ThreadPool;
import org.mortbay.workpool.thread.ThreadPoolAttributes;

import static org.awaitility.Awaitility.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConnectionDispatcherTest
{
    private final List<Client> _clients = new ArrayList<>();
    private ConnectionDispatcher _dispatcher;

    @AfterEach
    public void dispose() throws Exception
    {
        for (Client client : _clients)
        {
            client.close();
        }
        if (_dispatcher != null && !_dispatcher.getThreadPool().isDestroyed())
            _dispatcher.abort();
    }

    private void start(ThreadPoolAttributes attributes) throws IOException
    {
        _dispatcher = new ConnectionDispatcher(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), attributes, new EchoHandler());
        _dispatcher.start();
        assertThat(_dispatcher.getLocalPort(), greaterThan(0));
    }

    private Client connect() throws IOException
    {
        Client client = new Client(_dispatcher.getLocalPort());
        _clients.add(client);
        return client;
    }

    @Test
    public void testEcho() throws Exception
    {
        start(new ThreadPoolAttributes().setThreadCount(2).setBlockOnAdd(true));

        List<CompletableFuture<String>> replies = new ArrayList<>();
        for (int i = 0; i < 6; i++)
        {
            int id = i;
            replies.add(CompletableFuture.supplyAsync(() ->
            {
                try (Client client = new Client(_dispatcher.getLocalPort()))
                {
                    client.send("hello " + id);
                    String first = client.readLine();
                    client.send("bye " + id);
                    return first + "|" + client.readLine();
                }
                catch (IOException x)
                {
                    throw new RuntimeException(x);
                }
            }));
        }

        for (int i = 0; i < replies.size(); i++)
        {
            assertEquals("hello " + i + "|bye " + i, replies.get(i).get(10, TimeUnit.SECONDS));
        }
        await().atMost(5, TimeUnit.SECONDS).until(() -> _dispatcher.getConnections() == 0);

        _dispatcher.stop();
        assertTrue(_dispatcher.getThreadPool().isDestroyed());
        assertEquals(ShutdownMode.GRACEFUL, _dispatcher.getThreadPool().getShutdownMode());
    }

    @Test
    public void testStopWaitsForOpenConnection() throws Exception
    {
        start(new ThreadPoolAttributes().setThreadCount(1));
        Client client = connect();
        client.send("ping");
        assertEquals("ping", client.readLine());

        CompletableFuture<Void> stop = CompletableFuture.runAsync(() ->
        {
            try
            {
                _dispatcher.stop();
            }
            catch (InterruptedException x)
            {
                throw new RuntimeException(x);
            }
        });
        await().atMost(5, TimeUnit.SECONDS).until(() -> _dispatcher.getThreadPool().getBusyThreads() == 1);
        await().during(200, TimeUnit.MILLISECONDS).atMost(2, TimeUnit.SECONDS).until(() -> !stop.isDone());

        // The connection is still served.
        client.send("still there");
        assertEquals("still there", client.readLine());

        client.close();
        stop.get(5, TimeUnit.SECONDS);
        assertTrue(_dispatcher.getThreadPool().isDestroyed());
    }

    @Test
    public void testAbortClosesConnections() throws Exception
    {
        start(new ThreadPoolAttributes().setThreadCount(1).setQueueSize(4));
        Client served = connect();
        served.send("ping");
        assertEquals("ping", served.readLine());
        Client queued = connect();
        ThreadPool pool = _dispatcher.getThreadPool();
        await().atMost(5, TimeUnit.SECONDS).until(() -> pool.getQueued() == 1);

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> _dispatcher.abort());

        assertEquals(ShutdownMode.FORCEFUL, pool.getShutdownMode());
        assertNull(served.readLineOrNull());
        assertNull(queued.readLineOrNull());
        assertEquals(0, _dispatcher.getConnections());
        assertThrows(IllegalStateException.class, () -> _dispatcher.stop());
    }

    @Test
    public void testRejectedConnectionIsClosed() throws Exception
    {
        start(new ThreadPoolAttributes().setThreadCount(1).setQueueSize(1));
        ThreadPool pool = _dispatcher.getThreadPool();

        Client served = connect();
        await().atMost(5, TimeUnit.SECONDS).until(() -> pool.getBusyThreads() == 1);
        Client queued = connect();
        await().atMost(5, TimeUnit.SECONDS).until(() -> pool.getQueued() == 1);
        Client rejected = connect();

        assertNull(rejected.readLineOrNull());

        served.send("one");
        assertEquals("one", served.readLine());
        served.close();
        queued.send("two");
        assertEquals("two", queued.readLine());
        assertFalse(pool.isDestroyed());
    }

    @Test
    public void testStartTwice() throws Exception
    {
        start(new ThreadPoolAttributes().setThreadCount(1));
        assertThrows(IllegalStateException.class, () -> _dispatcher.start());
    }

    private static class Client implements AutoCloseable
    {
        private final Socket _socket;
        private final BufferedReader _in;
        private final Writer _out;

        private Client(int port) throws IOException
        {
            _socket = new Socket(InetAddress.getLoopbackAddress(), port);
            _socket.setSoTimeout(5000);
            _in = new BufferedReader(new InputStreamReader(_socket.getInputStream(), StandardCharsets.UTF_8));
            _out = new OutputStreamWriter(_socket.getOutputStream(), StandardCharsets.UTF_8);
        }

        private void send(String line) throws IOException
        {
            _out.write(line);
            _out.write('\n');
            _out.flush();
        }

        private String readLine() throws IOException
        {
            return _in.readLine();
        }

        /**
         * @return the next line, or null if the server closed the connection
         */
        private String readLineOrNull() throws IOException
        {
            try
            {
                return _in.readLine();
            }
            catch (SocketException x)
            {
                // Reset by the server.
                return null;
            }
        }

        @Override
        public void close() throws IOException
        {
            _socket.close();
        }
    }
}
