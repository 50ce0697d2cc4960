package villagecompute.vouch.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import villagecompute.vouch.api.types.ProfileType;
import villagecompute.vouch.data.models.User;
import villagecompute.vouch.data.models.Vouch;
import villagecompute.vouch.exceptions.ResourceNotFoundException;

/**
 * Assembles the profile view of a user from the directory, the ledger and the rank ladder.
 */
@ApplicationScoped
public class ProfileService {

    @Inject
    VouchLedgerService ledger;

    @Inject
    RankCalculationService rankCalculator;

    /**
     * @throws ResourceNotFoundException
     *             if the user does not exist
     */
    @Transactional
    public ProfileType getProfile(Long userId) {
        User user = User.findById(userId);
        if (user == null) {
            throw new ResourceNotFoundException("User not found: " + userId);
        }

        return new ProfileType(user.toSnapshot(),
                ledger.vouchesReceived(userId).stream().map(Vouch::toSnapshot).toList(),
                ledger.vouchesGiven(userId).stream().map(Vouch::toSnapshot).toList(),
                rankCalculator.nextThreshold(user.totalVouches), rankCalculator.progressPercentage(user.totalVouches));
    }
}
