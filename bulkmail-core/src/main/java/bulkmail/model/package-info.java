/**
 * Campaign, recipient, snapshot and delivery-log records plus their status enums.
 *
 * @see bulkmail.model.CampaignStatus
 */
package bulkmail.model;
