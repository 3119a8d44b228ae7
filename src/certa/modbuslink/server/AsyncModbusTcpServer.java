package certa.modbuslink.server;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.LoggerFactory;

import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusDiagnostics;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.Slf4jModbusDiagnostics;
import certa.modbuslink.frame.FrameReader;
import certa.modbuslink.frame.ModbusFrame;
import certa.modbuslink.frame.TcpFrameCodec;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.util.concurrent.GlobalEventExecutor;

/**
 * Modbus TCP server on Netty. A single event loop thread accepts and serves all connections.
 * Pipelined requests on one connection are answered in order.
 */
public class AsyncModbusTcpServer extends AModbusServer {

	private final String localAddressString;
	private final int localPort;
	private final int maxConnections;

	private EventLoopGroup group;
	private volatile Channel serverChannel;
	private ChannelGroup clients;

	public AsyncModbusTcpServer(String localIP, int localPort, int unitId, DataStore store) {
		this(localIP, localPort, ModbusTcpServer.MAX_CONNECTIONS, unitId, store, null, new Slf4jModbusDiagnostics());
	}

	public AsyncModbusTcpServer(String localIP, int localPort, int maxConnections, int unitId, DataStore store,
			RequestProcessor processor, ModbusDiagnostics diagnostics)
	{
		super(unitId, store, processor, true, diagnostics, LoggerFactory.getLogger(AsyncModbusTcpServer.class));
		this.localAddressString = (localIP != null) ? localIP : "0.0.0.0";
		this.localPort = localPort;
		this.maxConnections = maxConnections;
	}

	@Override
	synchronized public void start() throws ModbusConnectionException {
		if (serverChannel != null)
			return;
		log.info("Starting server on {}:{}", localAddressString, localPort);
		EventLoopGroup g = new NioEventLoopGroup(1);
		ChannelGroup channels = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
		ServerBootstrap bootstrap = new ServerBootstrap();
		bootstrap.group(g)
				.channel(NioServerSocketChannel.class)
				.childOption(ChannelOption.TCP_NODELAY, true)
				.childHandler(new ChannelInitializer<SocketChannel>() {
					@Override
					protected void initChannel(SocketChannel ch) {
						ch.pipeline().addLast(new RequestDecoder(), new RequestHandler());
					}
				});
		try {
			serverChannel = bootstrap.bind(new InetSocketAddress(localAddressString, localPort)).syncUninterruptibly().channel();
		} catch (Exception e) {
			g.shutdownGracefully(0, 1, TimeUnit.SECONDS);
			throw new ModbusConnectionException("Can't listen on " + localAddressString + ":" + localPort + ": " + e, e);
		}
		group = g;
		clients = channels;
		log.info("Server listening on {}", serverChannel.localAddress());
	}

	@Override
	synchronized public void stop() {
		Channel ch = serverChannel;
		if (ch == null)
			return;
		log.info("Stopping server");
		serverChannel = null;
		ch.close().awaitUninterruptibly();
		clients.close().awaitUninterruptibly();
		group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
		group = null;
	}

	@Override
	public boolean isRunning() {
		Channel ch = serverChannel;
		return (ch != null) && ch.isActive();
	}

	/**
	 * @return bound port, or -1 if the server isn't running
	 */
	public int getLocalPort() {
		Channel ch = serverChannel;
		return (ch != null) ? ((InetSocketAddress) ch.localAddress()).getPort() : -1;
	}

	public int getConnectedClientsCount() {
		ChannelGroup c = clients;
		return (serverChannel != null) && (c != null) ? c.size() : 0;
	}

	/**
	 * Splits the stream into frames. Netty buffers are copied into the frame reader,
	 * decoded frames travel on as {@link ModbusFrame}.
	 */
	private final class RequestDecoder extends ByteToMessageDecoder {
		private final FrameReader reader = new FrameReader(TcpFrameCodec.INSTANCE, true);

		@Override
		protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
			try {
				while (in.isReadable()) {
					byte[] chunk = new byte[in.readableBytes()];
					in.getBytes(in.readerIndex(), chunk);
					in.skipBytes(reader.feed(chunk, 0, chunk.length));
					if (!reader.isComplete())
						return;
					diagnostics.onFrameReceived(String.valueOf(ctx.channel().remoteAddress()), reader.getBuffer(), reader.getLength());
					out.add(reader.decode());
				}
			} catch (ModbusLinkException e) {
				diagnostics.onFrameError(String.valueOf(ctx.channel().remoteAddress()), e);
				in.skipBytes(in.readableBytes());
				ctx.close();
			}
		}
	}

	private final class RequestHandler extends SimpleChannelInboundHandler<ModbusFrame> {
		@Override
		public void channelActive(ChannelHandlerContext ctx) {
			if (clients.size() >= maxConnections) {
				log.warn("Too many connections, rejecting {}", ctx.channel().remoteAddress());
				ctx.close();
				return;
			}
			clients.add(ctx.channel());
			log.info("Client connected: {}", ctx.channel().remoteAddress());
		}

		@Override
		public void channelInactive(ChannelHandlerContext ctx) {
			log.info("Client disconnected: {}", ctx.channel().remoteAddress());
		}

		@Override
		protected void channelRead0(ChannelHandlerContext ctx, ModbusFrame request) {
			ModbusPdu response = handle(request);
			if (response == null)
				return;
			byte[] frame = TcpFrameCodec.INSTANCE.encode(new ModbusFrame(request.getTransactionId(), request.getUnitId(), response));
			ctx.writeAndFlush(Unpooled.wrappedBuffer(frame));
			diagnostics.onFrameSent(String.valueOf(ctx.channel().remoteAddress()), frame, frame.length);
		}

		@Override
		public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
			log.warn("Connection {} error: {}", ctx.channel().remoteAddress(), cause.toString());
			ctx.close();
		}
	}

}
