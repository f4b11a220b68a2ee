/**
 * Post 领域 - 帖子生命周期域
 *
 * <p>职责：帖子记录的状态机、内容编辑约束、发布结果记录</p>
 *
 * <h3>状态机</h3>
 * <pre>
 * draft --confirm--> scheduled --request_publish--> publishing --publish_succeeded--> published
 *   |                  |    ^ edit                        |
 *   +--cancel--+       +----+                             +--publish_failed--> failed --retry_publish--> publishing
 *              v            |
 *          cancelled <------+ cancel
 * </pre>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.postpilot.domain.post.model.entity.PostRecordEntity}</li>
 * </ul>
 *
 * <h3>端口</h3>
 * <ul>
 *   <li>{@link com.postpilot.domain.post.adapter.repository.IPostRecordRepository} - 帖子存储</li>
 *   <li>{@link com.postpilot.domain.post.adapter.gateway.IChannelPublisher} - 外部发布渠道</li>
 * </ul>
 *
 * @author postpilot
 * @since 2026-09-14
 */
package com.postpilot.domain.post;
