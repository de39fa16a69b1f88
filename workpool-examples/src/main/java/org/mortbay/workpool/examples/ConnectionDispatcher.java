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

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

import org.mortbay.workpool.thread.ShutdownMode;
import org.mortbay.workpool.thread.ThreadPool;
import org.mortbay.workpool.thread.ThreadPoolAttributes;
import org.mortbay.workpool.thread.WorkRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Accepts TCP connections and serves each one as a task of a {@link ThreadPool}.</p>
 * <p>An acceptor thread accepts connections and adds one task per connection
 * to the pool. A connection that the pool rejects is closed at once.</p>
 * <pre>
 * ConnectionDispatcher dispatcher = new ConnectionDispatcher(new InetSocketAddress(8080), new ThreadPoolAttributes(), new EchoHandler());
 * dispatcher.start();
 * ...
 * dispatcher.stop();
 * </pre>
 */
public class ConnectionDispatcher
{
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionDispatcher.class);

    private final InetSocketAddress _address;
    private final ThreadPoolAttributes _attributes;
    private final ConnectionHandler _handler;
    private final Set<Socket> _connections = ConcurrentHashMap.newKeySet();
    private volatile ServerSocket _serverSocket;
    private volatile ThreadPool _pool;
    private volatile Thread _acceptor;
    private volatile boolean _stopping;

    public ConnectionDispatcher(InetSocketAddress address, ThreadPoolAttributes attributes, ConnectionHandler handler)
    {
        _address = Objects.requireNonNull(address);
        _attributes = new ThreadPoolAttributes(attributes);
        _handler = Objects.requireNonNull(handler);
    }

    /**
     * <p>Binds the server socket, creates the pool and starts accepting.</p>
     *
     * @throws IOException if the address cannot be bound
     * @throws IllegalStateException if already started
     */
    public synchronized void start() throws IOException
    {
        if (_serverSocket != null)
            throw new IllegalStateException("Already started " + this);

        ServerSocket serverSocket = new ServerSocket();
        try
        {
            serverSocket.setReuseAddress(true);
            serverSocket.bind(_address);
        }
        catch (IOException x)
        {
            serverSocket.close();
            throw x;
        }
        _pool = new ThreadPool("dispatcher-" + serverSocket.getLocalPort(), _attributes);
        _serverSocket = serverSocket;
        _acceptor = new Thread(this::accept, "acceptor-" + serverSocket.getLocalPort());
        _acceptor.start();
        LOG.info("Started {}", this);
    }

    /**
     * @return the port the server socket is bound to, or -1 if not started
     */
    public int getLocalPort()
    {
        ServerSocket serverSocket = _serverSocket;
        return serverSocket == null ? -1 : serverSocket.getLocalPort();
    }

    public ThreadPool getThreadPool()
    {
        return _pool;
    }

    /**
     * @return the number of open connections, served or queued
     */
    public int getConnections()
    {
        return _connections.size();
    }

    private void accept()
    {
        while (!_stopping)
        {
            Socket socket;
            try
            {
                socket = _serverSocket.accept();
            }
            catch (IOException x)
            {
                if (_stopping)
                {
                    if (LOG.isDebugEnabled())
                        LOG.debug("Stopped accepting on {}", this, x);
                    return;
                }
                LOG.warn("Failed to accept on {}", this, x);
                if (_serverSocket.isClosed())
                    return;
                continue;
            }

            // Tracked from now on, so that an abort closes it even if it is still queued.
            _connections.add(socket);
            try
            {
                _pool.addWork(this::serve, _handler, socket);
                if (LOG.isDebugEnabled())
                    LOG.debug("Dispatched {}", socket);
            }
            catch (WorkRejectedException | TimeoutException x)
            {
                LOG.warn("Rejected {}: {}", socket.getRemoteSocketAddress(), x.toString());
                _connections.remove(socket);
                close(socket);
            }
            catch (InterruptedException x)
            {
                _connections.remove(socket);
                close(socket);
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void serve(ConnectionHandler handler, Socket socket)
    {
        try
        {
            handler.handle(socket);
        }
        catch (IOException x)
        {
            if (_stopping)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Connection {} closed on stop", socket, x);
            }
            else
            {
                LOG.warn("Failed to serve {}", socket.getRemoteSocketAddress(), x);
            }
        }
        finally
        {
            _connections.remove(socket);
            close(socket);
        }
    }

    /**
     * <p>Stops accepting, then waits for the connections being served or
     * queued to complete before destroying the pool.</p>
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void stop() throws InterruptedException
    {
        shutdown(ShutdownMode.GRACEFUL);
    }

    /**
     * <p>Stops accepting, closes the connections being served and drops the
     * queued ones.</p>
     *
     * @throws InterruptedException if interrupted while waiting for the workers
     */
    public void abort() throws InterruptedException
    {
        shutdown(ShutdownMode.FORCEFUL);
    }

    private synchronized void shutdown(ShutdownMode mode) throws InterruptedException
    {
        if (_serverSocket == null || _stopping)
            throw new IllegalStateException("Not running " + this);
        _stopping = true;

        close(_serverSocket);
        // The acceptor may be blocked adding work to a full queue.
        while (_acceptor.isAlive())
        {
            _pool.cancelWait();
            _acceptor.join(100);
        }

        if (mode == ShutdownMode.FORCEFUL)
        {
            // Blocking socket reads ignore interrupts, so the sockets are closed instead.
            for (Iterator<Socket> i = _connections.iterator(); i.hasNext(); )
            {
                close(i.next());
                i.remove();
            }
        }
        _pool.destroy(mode);
        LOG.info("Stopped {} {}", mode, this);
    }

    /**
     * Waits for the acceptor thread to exit.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void join() throws InterruptedException
    {
        Thread acceptor = _acceptor;
        if (acceptor != null)
            acceptor.join();
    }

    private static void close(Closeable closeable)
    {
        try
        {
            closeable.close();
        }
        catch (IOException x)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Failed to close {}", closeable, x);
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x{%s,%s}", getClass().getSimpleName(), hashCode(), _address, _stopping ? "STOPPING" : "RUNNING");
    }

    public static void main(String[] args) throws Exception
    {
        int port = args.length > 0 ? Integer.parseInt(args[0]) : 8080;
        ThreadPoolAttributes attributes = new ThreadPoolAttributes().setBlockOnAdd(true);
        ConnectionDispatcher dispatcher = new ConnectionDispatcher(new InetSocketAddress(port), attributes, new EchoHandler());
        dispatcher.start();
        Runtime.getRuntime().addShutdownHook(new Thread(() ->
        {
            try
            {
                dispatcher.abort();
            }
            catch (InterruptedException x)
            {
                Thread.currentThread().interrupt();
            }
        }, "dispatcher-shutdown"));
        dispatcher.join();
    }
}
