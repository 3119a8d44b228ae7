package certa.modbuslink.transport;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.LoggerFactory;

import certa.modbuslink.InvalidResponseException;
import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusDiagnostics;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.Slf4jModbusDiagnostics;
import certa.modbuslink.frame.ModbusFrame;
import certa.modbuslink.frame.TcpFrameCodec;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

/**
 * Modbus TCP client side on Netty, one event loop thread per transport.
 * Netty types stay inside this class; received data is copied into byte arrays.
 * The connection is dropped after a timeout or a malformed response, like {@link TcpTransport}.
 */
public class AsyncTcpTransport extends AbstractAsyncTransport {

	private final String remoteHost;
	private final int remotePort;
	private final int connectTimeout;
	private EventLoopGroup group; // guarded by this
	private volatile Channel channel;
	private int transactionId = 0;

	public AsyncTcpTransport(String remoteHost, int remotePort, int connectTimeout, int responseTimeout) {
		this(remoteHost, remotePort, connectTimeout, responseTimeout, new Slf4jModbusDiagnostics());
	}

	public AsyncTcpTransport(String remoteHost, int remotePort, int connectTimeout, int responseTimeout,
			ModbusDiagnostics diagnostics) {
		super(TcpFrameCodec.INSTANCE, responseTimeout, diagnostics, LoggerFactory.getLogger(AsyncTcpTransport.class));
		this.remoteHost = remoteHost;
		this.remotePort = remotePort;
		this.connectTimeout = connectTimeout;
	}

	@Override
	public String getName() {
		return remoteHost + ":" + remotePort;
	}

	@Override
	synchronized public CompletableFuture<Void> open() {
		if (isOpen())
			return CompletableFuture.completedFuture(null);
		log.info("Connecting to {}, respTO: {}, connTO: {}", getName(), timeout, connectTimeout);
		if (group == null)
			group = new NioEventLoopGroup(1);
		Bootstrap bootstrap = new Bootstrap();
		bootstrap.group(group)
				.channel(NioSocketChannel.class)
				.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeout)
				.option(ChannelOption.TCP_NODELAY, true)
				.handler(new ChannelInitializer<SocketChannel>() {
					@Override
					protected void initChannel(SocketChannel ch) {
						ch.pipeline().addLast(new InboundHandler());
					}
				});
		CompletableFuture<Void> result = new CompletableFuture<>();
		ChannelFuture f = bootstrap.connect(remoteHost, remotePort);
		f.addListener((ChannelFutureListener) future -> {
			if (future.isSuccess()) {
				channel = future.channel();
				log.info("Connected: {} <-> {}", channel.localAddress(), channel.remoteAddress());
				result.complete(null);
			} else {
				result.completeExceptionally(new ModbusConnectionException(
						"Can't connect to " + getName() + ": " + future.cause(), future.cause()));
			}
		});
		return result;
	}

	@Override
	public boolean isOpen() {
		Channel ch = channel;
		return (ch != null) && ch.isActive();
	}

	@Override
	public CompletableFuture<Void> close() {
		Channel ch;
		EventLoopGroup g;
		synchronized (this) {
			ch = channel;
			g = group;
			channel = null;
			group = null;
		}
		failPending(new ModbusConnectionException("Connection to " + getName() + " closed"));
		CompletableFuture<Void> result = new CompletableFuture<>();
		if (g == null) {
			result.complete(null);
			return result;
		}
		log.info("Closing connection to {}", getName());
		if (ch != null)
			ch.close();
		g.shutdownGracefully(0, 1, TimeUnit.SECONDS).addListener(future -> result.complete(null));
		return result;
	}

	@Override
	protected int nextTransactionId() {
		transactionId++;
		if (transactionId > 65535)
			transactionId = 1;
		return transactionId;
	}

	@Override
	protected CompletableFuture<Void> sendData(byte[] frame) {
		CompletableFuture<Void> result = new CompletableFuture<>();
		Channel ch = channel;
		if (ch == null) {
			result.completeExceptionally(new ModbusConnectionException(getName() + " is not open"));
			return result;
		}
		ch.writeAndFlush(Unpooled.wrappedBuffer(frame)).addListener((ChannelFutureListener) future -> {
			if (future.isSuccess())
				result.complete(null);
			else
				result.completeExceptionally(new ModbusConnectionException(
						"Write error on " + getName() + ": " + future.cause(), future.cause()));
		});
		return result;
	}

	@Override
	protected void checkResponse(int transactionId, int unitId, ModbusPdu request, ModbusFrame response) throws ModbusLinkException {
		if (response.getTransactionId() != transactionId)
			throw new InvalidResponseException("Invalid transaction id: " + response.getTransactionId()
					+ " (expected: " + transactionId + ")");
		super.checkResponse(transactionId, unitId, request, response);
	}

	@Override
	protected void exchangeFailed(ModbusLinkException e) {
		switch (e.getKind()) {
		case TIMEOUT:
		case INVALID_RESPONSE:
			Channel ch = channel;
			if (ch != null) {
				log.warn("Dropping connection to {}: {}", getName(), e.getMessage());
				ch.close();
			}
			break;
		default:
			break;
		}
	}

	private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf> {
		@Override
		protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg) {
			byte[] data = new byte[msg.readableBytes()];
			msg.readBytes(data);
			onReceive(data);
		}

		@Override
		public void channelInactive(ChannelHandlerContext ctx) {
			log.info("Connection to {} closed", getName());
			failPending(new ModbusConnectionException("Connection to " + getName() + " lost"));
		}

		@Override
		public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
			log.warn("Connection error on {}: {}", getName(), cause.toString());
			ctx.close();
		}
	}

}
