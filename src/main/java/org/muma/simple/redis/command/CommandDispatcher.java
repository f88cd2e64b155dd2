package org.muma.simple.redis.command;

import org.muma.simple.redis.command.impl.connection.EchoCommand;
import org.muma.simple.redis.command.impl.hash.HGetAllCommand;
import org.muma.simple.redis.command.impl.hash.HGetCommand;
import org.muma.simple.redis.command.impl.hash.HMGetCommand;
import org.muma.simple.redis.command.impl.hash.HSetCommand;
import org.muma.simple.redis.command.impl.set.SAddCommand;
import org.muma.simple.redis.command.impl.set.SIsMemberCommand;
import org.muma.simple.redis.command.impl.set.SMembersCommand;
import org.muma.simple.redis.command.impl.string.GetCommand;
import org.muma.simple.redis.command.impl.string.SetCommand;
import org.muma.simple.redis.protocol.BulkString;
import org.muma.simple.redis.protocol.ErrorMessage;
import org.muma.simple.redis.protocol.RedisArray;
import org.muma.simple.redis.protocol.RedisMessage;
import org.muma.simple.redis.store.StorageEngine;
import org.muma.simple.redis.store.WrongTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * 把一个解码后的请求翻译成命令调用。
 * <p>
 * 请求形状、命令名、参数个数都在触碰存储之前检查完毕；所有命令级别的错误都转成
 * {@link ErrorMessage} 返回，连接不会因为一条坏命令而关闭。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    public static final ErrorMessage INVALID_REQUEST = new ErrorMessage("ERR invalid request");

    private static final long SLOW_COMMAND_MILLIS = 10;

    private final Map<CommandType, RedisCommand> commandMap = new EnumMap<>(CommandType.class);
    private final StorageEngine storage;

    public CommandDispatcher(StorageEngine storage) {
        this.storage = storage;
        for (CommandType type : CommandType.values()) {
            commandMap.put(type, createCommand(type));
        }
        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    // 命令集合是封闭的，新增枚举值而漏掉这里会直接编译失败
    private static RedisCommand createCommand(CommandType type) {
        return switch (type) {
            case ECHO -> new EchoCommand();
            case GET -> new GetCommand();
            case SET -> new SetCommand();
            case HSET -> new HSetCommand();
            case HGET -> new HGetCommand();
            case HMGET -> new HMGetCommand();
            case HGETALL -> new HGetAllCommand();
            case SADD -> new SAddCommand();
            case SISMEMBER -> new SIsMemberCommand();
            case SMEMBERS -> new SMembersCommand();
        };
    }

    /**
     * 核心分发逻辑
     */
    public RedisMessage dispatch(RedisMessage request) {
        // 1. 请求必须是非空数组，且每个元素都是非 nil 的 BulkString
        if (!isWellFormed(request)) {
            log.warn("Rejected malformed request: {}", request);
            return INVALID_REQUEST;
        }
        RedisArray args = (RedisArray) request;
        String commandName = ((BulkString) args.elements()[0]).asString();

        // 2. 查找命令
        CommandType type = CommandType.lookup(commandName);
        if (type == null) {
            log.warn("Command not found: {}", commandName);
            return new ErrorMessage("ERR unknown command '" + commandName + "'");
        }

        // 3. 参数个数
        if (!type.acceptsArgc(args.size())) {
            return new ErrorMessage("ERR wrong number of arguments for '" + type.displayName() + "' command");
        }

        // 4. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response = commandMap.get(type).execute(storage, args);

            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > SLOW_COMMAND_MILLIS) {
                log.warn("Slow command detected: {} cost {}ms", type, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} (write={}) cost {}ms", type, type.isWrite(), duration);
            }
            return response;

        } catch (WrongTypeException e) {
            // 预期内的业务错误，存储没有被修改
            log.debug("Command {} rejected: expected {}, found {}", type, e.getExpected(), e.getActual());
            return new ErrorMessage(e.getMessage());

        } catch (RuntimeException e) {
            // 意料之外的系统错误
            log.error("Internal Server Error processing command: {}", type, e);
            return new ErrorMessage("ERR internal server error");
        }
    }

    private static boolean isWellFormed(RedisMessage request) {
        if (!(request instanceof RedisArray array) || array.isNull() || array.size() == 0) {
            return false;
        }
        for (RedisMessage element : array.elements()) {
            if (!(element instanceof BulkString bulk) || bulk.isNull()) {
                return false;
            }
        }
        return true;
    }
}
